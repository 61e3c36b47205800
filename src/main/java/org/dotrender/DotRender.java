/*
 * Copyright 2020 C. Schanck
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.dotrender;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders any graph into Graphviz dot text, without forcing the graph into a
 * particular class. The caller describes its graph through two small interfaces:
 * {@link GraphWalk} says what the nodes, edges and subgraphs are, and {@link Labeller}
 * says what they are called and how they look. A {@link Renderer} walks both and
 * writes the dot document to a {@link Writer} or {@link OutputStream}.
 * <p>Output order is exactly the order the graph enumerates things in: subgraphs
 * first, then one statement per node, then one per edge. Nothing is sorted, so if you
 * want stable diffs, sort inside your own {@code nodes()}/{@code edges()}.
 * <p>For simple cases {@link LabelledGraph} is a ready made, fluent graph that
 * implements both interfaces.
 * <p>Excellent online viewer for dotty files here:
 * https://dreampuf.github.io/GraphvizOnline/
 */
public final class DotRender {
  private static final Logger LOGGER = Logger.getLogger(DotRender.class.getName());
  final static String INDENTION = "    ";

  private DotRender() {
  }

  /**
   * Thrown when a string cannot be used as a dot identifier.
   */
  public static class IdException extends IllegalArgumentException {
    public IdException(String message) {
      super(message);
    }
  }

  /**
   * Any failure writing to the output sink. Rendering stops at the first one; whatever
   * was already written stays written.
   */
  public static class DotWriteException extends IOException {
    public DotWriteException(String message, IOException cause) {
      super(message, cause);
    }
  }

  /**
   * A dot identifier. Plain identifiers ({@code [A-Za-z_][A-Za-z0-9_]*}) are written
   * as is; anything else is written as a double quoted string, with embedded quotes
   * escaped. Dot keywords are always quoted. Control characters and backslashes are
   * refused, since graphviz gives them inconsistent meanings inside quoted ids.
   */
  public static final class Id {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Set<String> KEYWORDS = Set.of("graph", "digraph", "subgraph", "node", "edge", "strict");

    private final String name;
    private final boolean quoted;

    private Id(String name, boolean quoted) {
      this.name = name;
      this.quoted = quoted;
    }

    /**
     * Validate and create.
     * @param candidate proposed name
     * @return id
     * @throws IdException if the candidate is empty or unrepresentable
     */
    public static Id of(String candidate) {
      String problem = problem(candidate);
      if (problem != null) {
        throw new IdException(problem);
      }
      boolean plain = IDENTIFIER.matcher(candidate).matches() &&
                      !KEYWORDS.contains(candidate.toLowerCase(Locale.ROOT));
      return new Id(candidate, !plain);
    }

    public static boolean isValid(String candidate) {
      return problem(candidate) == null;
    }

    private static String problem(String candidate) {
      if (candidate == null || candidate.isEmpty()) {
        return "Empty dot id";
      }
      for (int i = 0; i < candidate.length(); i++) {
        char ch = candidate.charAt(i);
        if (ch == '\\' || Character.isISOControl(ch)) {
          return "Unrepresentable character at " + i + " in dot id: " + candidate;
        }
      }
      return null;
    }

    public String name() {
      return name;
    }

    public boolean isQuoted() {
      return quoted;
    }

    public String toDotString() {
      if (quoted) {
        return '"' + name.replace("\"", "\\\"") + '"';
      }
      return name;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) { return true; }
      if (o == null || getClass() != o.getClass()) { return false; }
      Id id = (Id) o;
      return name.equals(id.name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public String toString() {
      return "Id{" + "name='" + name + '\'' + '}';
    }
  }

  /**
   * Text for a label, color or shape. Exactly one escaping strategy applies per form.
   */
  public static final class Text {
    public enum Form {
      /**
       * Plain text; backslashes, quotes and line breaks are escaped so they show up
       * as themselves.
       */
      LABEL,
      /**
       * Graphviz escString; backslash pairs are left alone so {@code \l}, {@code \r}
       * and {@code \n} keep their justification meaning and {@code \"} stays an
       * escaped quote. Bare quotes, raw line breaks and a trailing lone backslash
       * are escaped, so the quoted string always terminates.
       */
      ESCAPED,
      /**
       * HTML-like label, written between {@code <} and {@code >} with no escaping
       * at all.
       */
      HTML
    }

    private final Form form;
    private final String content;

    private Text(Form form, String content) {
      this.form = form;
      this.content = Objects.requireNonNull(content);
    }

    public static Text label(String text) {
      return new Text(Form.LABEL, text);
    }

    public static Text escaped(String text) {
      return new Text(Form.ESCAPED, text);
    }

    public static Text html(String text) {
      return new Text(Form.HTML, text);
    }

    public Form form() {
      return form;
    }

    public String content() {
      return content;
    }

    /**
     * Render, including the surrounding quotes or angle brackets.
     * @return dot text
     */
    public String toDotString() {
      switch (form) {
        case LABEL:
          return '"' + escape(content, true) + '"';
        case ESCAPED:
          return '"' + escape(content, false) + '"';
        default:
          return '<' + content + '>';
      }
    }

    /**
     * Puts {@code suffix} on a line below this text, with a blank line between.
     * For LABEL and ESCAPED text the result renders each side exactly as it would
     * have rendered alone; HTML text loses its markup and shows up literally.
     * @param suffix text for below
     * @return escString text
     */
    public Text suffixLine(Text suffix) {
      return escaped(preEscapedContent() + "\\n\\n" + suffix.preEscapedContent());
    }

    // content which, as an escString, renders the same as this
    private String preEscapedContent() {
      if (form == Form.LABEL) {
        return content.replace("\\", "\\\\");
      }
      return content;
    }

    private static String escape(String str, boolean backslash) {
      StringBuilder sb = null;
      for (int i = 0; i < str.length(); i++) {
        char ch = str.charAt(i);
        int start = i;
        String rep;
        switch (ch) {
          case '\\':
            if (!backslash && i + 1 < str.length() && !isLineControl(str.charAt(i + 1))) {
              // an escString pair such as \l or \" passes through whole
              rep = str.substring(i, i + 2);
              i++;
            } else {
              rep = "\\\\";
            }
            break;
          case '"':
            rep = "\\\"";
            break;
          case '\n':
            rep = "\\n";
            break;
          case '\r':
            rep = "\\r";
            break;
          case '\t':
            rep = "\\t";
            break;
          default:
            rep = null;
            break;
        }
        if (rep != null) {
          if (sb == null) {
            sb = new StringBuilder(str.length() + 8);
            sb.append(str, 0, start);
          }
          sb.append(rep);
        } else if (sb != null) {
          sb.append(ch);
        }
      }
      return sb == null ? str : sb.toString();
    }

    private static boolean isLineControl(char ch) {
      return ch == '\n' || ch == '\r' || ch == '\t';
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) { return true; }
      if (o == null || getClass() != o.getClass()) { return false; }
      Text text = (Text) o;
      return form == text.form && content.equals(text.content);
    }

    @Override
    public int hashCode() {
      return Objects.hash(form, content);
    }

    @Override
    public String toString() {
      return "Text{" + "form=" + form + ", content='" + content + '\'' + '}';
    }
  }

  /**
   * Style keywords. {@code none} means no style attribute at all. Not every style is
   * meaningful for edges.
   */
  public enum Style {
    none, solid, dashed, dotted, bold, rounded, diagonals, filled, striped, wedged, invis;

    public String dotName() {
      return this == none ? "" : name();
    }
  }

  public enum Kind {
    DIGRAPH("digraph", "->"), GRAPH("graph", "--");

    private final String keyword;
    private final String edgeOp;

    Kind(String keyword, String edgeOp) {
      this.keyword = keyword;
      this.edgeOp = edgeOp;
    }

    public String keyword() {
      return keyword;
    }

    public String edgeOp() {
      return edgeOp;
    }
  }

  /**
   * Rank constraint for the nodes of a subgraph.
   */
  public enum Rank {
    SAME, MIN, MAX, SOURCE, SINK;

    public String dotName() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  public enum Fill {
    OPEN("o"), FILLED("");

    private final String prefix;

    Fill(String prefix) {
      this.prefix = prefix;
    }
  }

  /**
   * Which half of an arrow shape is drawn.
   */
  public enum Side {
    LEFT("l"), RIGHT("r"), BOTH("");

    private final String prefix;

    Side(String prefix) {
      this.prefix = prefix;
    }
  }

  /**
   * Arrow shapes, see https://graphviz.org/doc/info/arrows.html. Each knows which
   * modifiers it accepts.
   */
  public enum Arrows {
    NONE(false, false), NORMAL(true, true), BOX(true, true), CROW(false, true), CURVE(false, true),
    ICURVE(true, true), DIAMOND(true, true), DOT(true, false), INV(true, true), TEE(false, true), VEE(false, true);

    private final boolean fillable;
    private final boolean sided;

    Arrows(boolean fillable, boolean sided) {
      this.fillable = fillable;
      this.sided = sided;
    }

    public ArrowShape shape() {
      return new ArrowShape(this, Fill.FILLED, Side.BOTH);
    }
  }

  /**
   * One arrow shape plus its fill and side modifiers.
   */
  public static final class ArrowShape {
    private final Arrows type;
    private final Fill fill;
    private final Side side;

    private ArrowShape(Arrows type, Fill fill, Side side) {
      this.type = type;
      this.fill = fill;
      this.side = side;
    }

    public ArrowShape fill(Fill fill) {
      if (fill != Fill.FILLED && !type.fillable) {
        throw new IllegalArgumentException("Arrow " + type + " cannot be " + fill);
      }
      return new ArrowShape(type, fill, side);
    }

    public ArrowShape open() {
      return fill(Fill.OPEN);
    }

    public ArrowShape side(Side side) {
      if (side != Side.BOTH && !type.sided) {
        throw new IllegalArgumentException("Arrow " + type + " cannot be clipped to " + side);
      }
      return new ArrowShape(type, fill, side);
    }

    public ArrowShape left() {
      return side(Side.LEFT);
    }

    public ArrowShape right() {
      return side(Side.RIGHT);
    }

    public String toDotString() {
      return fill.prefix + side.prefix + type.name().toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) { return true; }
      if (o == null || getClass() != o.getClass()) { return false; }
      ArrowShape that = (ArrowShape) o;
      return type == that.type && fill == that.fill && side == that.side;
    }

    @Override
    public int hashCode() {
      return Objects.hash(type, fill, side);
    }

    @Override
    public String toString() {
      return "ArrowShape{" + toDotString() + '}';
    }
  }

  /**
   * An arrow at one end of an edge, made of up to four shapes. {@link #DEFAULT} has
   * no shapes and produces no attribute.
   */
  public static final class Arrow {
    public static final Arrow DEFAULT = new Arrow(Collections.emptyList());

    private final List<ArrowShape> shapes;

    private Arrow(List<ArrowShape> shapes) {
      this.shapes = shapes;
    }

    public static Arrow of(ArrowShape... shapes) {
      if (shapes.length == 0) {
        return DEFAULT;
      }
      if (shapes.length > 4) {
        throw new IllegalArgumentException("At most 4 arrow shapes; got " + shapes.length);
      }
      return new Arrow(Collections.unmodifiableList(Arrays.asList(shapes.clone())));
    }

    public static Arrow none() {
      return of(Arrows.NONE.shape());
    }

    public static Arrow normal() {
      return of(Arrows.NORMAL.shape());
    }

    public boolean isDefault() {
      return shapes.isEmpty();
    }

    public List<ArrowShape> getShapes() {
      return shapes;
    }

    public String toDotString() {
      return shapes.stream().map(ArrowShape::toDotString).collect(Collectors.joining());
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) { return true; }
      if (o == null || getClass() != o.getClass()) { return false; }
      return shapes.equals(((Arrow) o).shapes);
    }

    @Override
    public int hashCode() {
      return shapes.hashCode();
    }

    @Override
    public String toString() {
      return "Arrow{" + shapes + '}';
    }
  }

  /**
   * The structure of a graph. Every enumeration must be finite, and must yield the same
   * elements each time it is called during a single render.
   * @param <N> node
   * @param <E> edge
   * @param <S> subgraph
   */
  public interface GraphWalk<N, E, S> {
    /**
     * All nodes. Nodes referenced by edges but missing here get no attribute statement.
     * @return nodes
     */
    Iterable<N> nodes();

    Iterable<E> edges();

    N source(E edge);

    N target(E edge);

    default Iterable<S> subgraphs() {
      return Collections.emptyList();
    }

    /**
     * Membership, not ownership; a node may sit in any number of subgraphs.
     * @param subgraph subgraph
     * @return member nodes
     */
    default Iterable<N> subgraphNodes(S subgraph) {
      return Collections.emptyList();
    }
  }

  /**
   * Naming and presentation policy for a graph. Only the graph id and node ids are
   * required, the rest default to "nothing special".
   * @param <N> node
   * @param <E> edge
   * @param <S> subgraph
   */
  public interface Labeller<N, E, S> {
    Id graphId();

    /**
     * Must be unique per node. This is not checked; two nodes with the same id are
     * drawn as one.
     * @param node node
     * @return id
     */
    Id nodeId(N node);

    /**
     * Defaults to the node's id as plain text.
     * @param node node
     * @return label
     */
    default Text nodeLabel(N node) {
      return Text.label(nodeId(node).name());
    }

    default Style nodeStyle(N node) {
      return Style.none;
    }

    default Optional<Text> nodeColor(N node) {
      return Optional.empty();
    }

    /**
     * Graphviz shape name, see https://graphviz.org/doc/info/shapes.html.
     * @param node node
     * @return shape, or empty for no shape attribute
     */
    default Optional<Text> nodeShape(N node) {
      return Optional.empty();
    }

    default Text edgeLabel(E edge) {
      return Text.label("");
    }

    default Style edgeStyle(E edge) {
      return Style.none;
    }

    default Optional<Text> edgeColor(E edge) {
      return Optional.empty();
    }

    default Arrow edgeStartArrow(E edge) {
      return Arrow.DEFAULT;
    }

    default Arrow edgeEndArrow(E edge) {
      return Arrow.DEFAULT;
    }

    /**
     * Subgraph id. Prefix it with {@code cluster_} to have graphviz draw the subgraph in
     * its own box. Empty renders an anonymous subgraph.
     * @param subgraph subgraph
     * @return id
     */
    default Optional<Id> subgraphId(S subgraph) {
      return Optional.empty();
    }

    default Text subgraphLabel(S subgraph) {
      return Text.label("");
    }

    default Style subgraphStyle(S subgraph) {
      return Style.none;
    }

    default Optional<Text> subgraphColor(S subgraph) {
      return Optional.empty();
    }

    /**
     * Default shape for the nodes drawn inside the subgraph.
     * @param subgraph subgraph
     * @return shape
     */
    default Optional<Text> subgraphShape(S subgraph) {
      return Optional.empty();
    }

    default Optional<Rank> subgraphRank(S subgraph) {
      return Optional.empty();
    }

    default Kind kind() {
      return Kind.DIGRAPH;
    }
  }

  public enum RenderOption {
    NO_NODE_LABELS, NO_EDGE_LABELS, NO_NODE_STYLES, NO_EDGE_STYLES, NO_NODE_COLORS, NO_EDGE_COLORS, NO_ARROWS,
    /**
     * White on black.
     */
    DARK_THEME
  }

  final static Function<Object, String> XFORM_TEXT = (in) -> ((Text) in).toDotString();
  final static Function<Object, String> XFORM_QUOTED = (in) -> '"' + in.toString() + '"';
  final static Function<Object, String> XFORM_TOSTRING = Objects::toString;

  static class Attribute {
    final String name;
    final Object value;
    final Function<Object, String> xform;

    Attribute(String name, Object value, Function<Object, String> xform) {
      this.name = name;
      this.value = value;
      this.xform = xform;
    }

    void emit(StringBuilder sb) {
      if (value != null) {
        sb.append('[').append(name).append('=').append(xform.apply(value)).append(']');
      }
    }

    void emitStatement(List<String> lines, String indent) {
      if (value != null) {
        lines.add(indent + name + '=' + xform.apply(value) + ';');
      }
    }
  }

  /**
   * Writes graphs as dot. Holds options only; nothing carries over between calls.
   * Configuration is not synchronized: set every option and the font before a
   * renderer is shared, after which it can serve several threads as long as each
   * renders its own graph to its own sink.
   */
  public static class Renderer {
    private final EnumSet<RenderOption> options = EnumSet.noneOf(RenderOption.class);
    private String fontname = null;

    public Renderer option(RenderOption... opts) {
      options.addAll(Arrays.asList(opts));
      return this;
    }

    public Renderer fontname(String fontname) {
      this.fontname = fontname;
      return this;
    }

    public boolean has(RenderOption opt) {
      return options.contains(opt);
    }

    public <N, E, S, G extends GraphWalk<N, E, S> & Labeller<N, E, S>> void render(G graph, Writer out)
      throws IOException {
      render(graph, graph, out);
    }

    /**
     * Render as UTF-8. The stream is flushed, not closed.
     * @param graph graph
     * @param out stream
     * @throws IOException on write failure
     */
    public <N, E, S, G extends GraphWalk<N, E, S> & Labeller<N, E, S>> void render(G graph, OutputStream out)
      throws IOException {
      render(graph, graph, new OutputStreamWriter(Objects.requireNonNull(out), StandardCharsets.UTF_8));
    }

    /**
     * Render, with structure and presentation coming from separate objects. The writer
     * is flushed, not closed.
     * @param walk structure
     * @param labeller presentation
     * @param out writer
     * @throws DotWriteException on the first write failure
     */
    public <N, E, S> void render(GraphWalk<N, E, S> walk, Labeller<N, E, S> labeller, Writer out)
      throws IOException {
      Objects.requireNonNull(walk);
      Objects.requireNonNull(labeller);
      Sink sink = new Sink(Objects.requireNonNull(out));

      // ids are resolved before anything is written
      Kind kind = labeller.kind();
      Id graphId = labeller.graphId();
      LOGGER.log(Level.FINE, "Rendering {0} {1}", new Object[] { kind.keyword(), graphId.name() });

      sink.line(kind.keyword() + " " + graphId.toDotString() + " {");
      emitGlobals(sink);

      int subgraphs = 0;
      for (S sub : walk.subgraphs()) {
        emitSubgraph(sink, walk, labeller, sub);
        subgraphs++;
      }

      int nodes = 0;
      for (N node : walk.nodes()) {
        sink.line(nodeStatement(labeller, node));
        nodes++;
      }

      int edges = 0;
      for (E edge : walk.edges()) {
        sink.line(edgeStatement(walk, labeller, kind, edge));
        edges++;
      }

      sink.line("}");
      sink.flush();
      LOGGER.log(Level.FINE, "Rendered {0}: {1} subgraphs, {2} nodes, {3} edges",
                 new Object[] { graphId.name(), subgraphs, nodes, edges });
    }

    private void emitGlobals(Sink sink) throws DotWriteException {
      List<String> graphAttrs = new ArrayList<>();
      List<String> contentAttrs = new ArrayList<>();
      if (fontname != null) {
        String font = "fontname=" + Text.label(fontname).toDotString();
        graphAttrs.add(font);
        contentAttrs.add(font);
      }
      if (has(RenderOption.DARK_THEME)) {
        graphAttrs.add("bgcolor=\"black\"");
        graphAttrs.add("fontcolor=\"white\"");
        contentAttrs.add("color=\"white\"");
        contentAttrs.add("fontcolor=\"white\"");
      }
      if (!graphAttrs.isEmpty()) {
        String content = String.join(" ", contentAttrs);
        sink.line(INDENTION + "graph[" + String.join(" ", graphAttrs) + "];");
        sink.line(INDENTION + "node[" + content + "];");
        sink.line(INDENTION + "edge[" + content + "];");
      }
    }

    private <N, E, S> void emitSubgraph(Sink sink, GraphWalk<N, E, S> walk, Labeller<N, E, S> labeller, S sub)
      throws DotWriteException {
      String inner = INDENTION + INDENTION;
      Optional<Id> id = labeller.subgraphId(sub);
      sink.line(INDENTION + "subgraph " + id.map(i -> i.toDotString() + " ").orElse("") + "{");

      Style style = labeller.subgraphStyle(sub);
      List<String> lines = new ArrayList<>();
      new Attribute("label", labeller.subgraphLabel(sub), XFORM_TEXT).emitStatement(lines, inner);
      new Attribute("style", style == Style.none ? null : style.dotName(), XFORM_QUOTED).emitStatement(lines, inner);
      new Attribute("color", labeller.subgraphColor(sub).orElse(null), XFORM_TEXT).emitStatement(lines, inner);
      labeller.subgraphShape(sub).ifPresent(s -> lines.add(inner + "node[shape=" + s.toDotString() + "];"));
      new Attribute("rank", labeller.subgraphRank(sub).map(Rank::dotName).orElse(null), XFORM_TOSTRING)
        .emitStatement(lines, inner);
      for (String line : lines) {
        sink.line(line);
      }
      sink.line("");

      for (N node : walk.subgraphNodes(sub)) {
        sink.line(inner + labeller.nodeId(node).toDotString() + ";");
      }
      sink.line(INDENTION + "}");
      sink.line("");
    }

    private <N, E, S> String nodeStatement(Labeller<N, E, S> labeller, N node) {
      StringBuilder sb = new StringBuilder(INDENTION).append(labeller.nodeId(node).toDotString());
      if (!has(RenderOption.NO_NODE_LABELS)) {
        new Attribute("label", labeller.nodeLabel(node), XFORM_TEXT).emit(sb);
      }
      if (!has(RenderOption.NO_NODE_STYLES)) {
        Style style = labeller.nodeStyle(node);
        new Attribute("style", style == Style.none ? null : style.dotName(), XFORM_QUOTED).emit(sb);
      }
      if (!has(RenderOption.NO_NODE_COLORS)) {
        new Attribute("color", labeller.nodeColor(node).orElse(null), XFORM_TEXT).emit(sb);
      }
      new Attribute("shape", labeller.nodeShape(node).orElse(null), XFORM_TEXT).emit(sb);
      return sb.append(';').toString();
    }

    private <N, E, S> String edgeStatement(GraphWalk<N, E, S> walk, Labeller<N, E, S> labeller, Kind kind, E edge) {
      StringBuilder sb = new StringBuilder(INDENTION);
      sb.append(labeller.nodeId(walk.source(edge)).toDotString());
      sb.append(' ').append(kind.edgeOp()).append(' ');
      sb.append(labeller.nodeId(walk.target(edge)).toDotString());
      if (!has(RenderOption.NO_EDGE_LABELS)) {
        new Attribute("label", labeller.edgeLabel(edge), XFORM_TEXT).emit(sb);
      }
      if (!has(RenderOption.NO_EDGE_STYLES)) {
        Style style = labeller.edgeStyle(edge);
        new Attribute("style", style == Style.none ? null : style.dotName(), XFORM_QUOTED).emit(sb);
      }
      if (!has(RenderOption.NO_EDGE_COLORS)) {
        new Attribute("color", labeller.edgeColor(edge).orElse(null), XFORM_TEXT).emit(sb);
      }
      if (!has(RenderOption.NO_ARROWS)) {
        Arrow start = labeller.edgeStartArrow(edge);
        Arrow end = labeller.edgeEndArrow(edge);
        if (!start.isDefault() || !end.isDefault()) {
          List<String> opts = new ArrayList<>(3);
          if (!end.isDefault()) {
            opts.add("arrowhead=\"" + end.toDotString() + '"');
          }
          if (!start.isDefault()) {
            opts.add("dir=\"both\"");
            opts.add("arrowtail=\"" + start.toDotString() + '"');
          }
          sb.append('[').append(String.join(" ", opts)).append(']');
        }
      }
      return sb.append(';').toString();
    }
  }

  /**
   * Line at a time writer; every failure becomes a {@link DotWriteException}.
   */
  private static class Sink {
    private final Writer out;
    private int lines = 0;

    Sink(Writer out) {
      this.out = out;
    }

    void line(String text) throws DotWriteException {
      try {
        out.write(text + '\n');
      } catch (IOException e) {
        throw failed(e);
      }
      lines++;
    }

    void flush() throws DotWriteException {
      try {
        out.flush();
      } catch (IOException e) {
        throw failed(e);
      }
    }

    private DotWriteException failed(IOException e) {
      LOGGER.log(Level.WARNING, "Dot output failed after " + lines + " lines", e);
      return new DotWriteException("Dot output failed after " + lines + " lines", e);
    }
  }

  public static <N, E, S, G extends GraphWalk<N, E, S> & Labeller<N, E, S>> void render(G graph, Writer out)
    throws IOException {
    new Renderer().render(graph, out);
  }

  public static <N, E, S, G extends GraphWalk<N, E, S> & Labeller<N, E, S>> void render(G graph, OutputStream out)
    throws IOException {
    new Renderer().render(graph, out);
  }

  /**
   * Render with default options into a string.
   * @param graph graph
   * @return dot document
   */
  public static <N, E, S, G extends GraphWalk<N, E, S> & Labeller<N, E, S>> String renderToString(G graph) {
    StringWriter sw = new StringWriter();
    try {
      new Renderer().render(graph, sw);
    } catch (IOException e) {
      // StringWriter does not fail
      throw new UncheckedIOException(e);
    }
    return sw.toString();
  }

  /**
   * A mutable graph with a fluent API that implements both {@link GraphWalk} and
   * {@link Labeller}. Nodes are unique by id and kept in insertion order; edges and
   * clusters render in the order added.
   */
  public static class LabelledGraph
    implements GraphWalk<LabelledGraph.Node, LabelledGraph.Connection, LabelledGraph.Cluster>,
    Labeller<LabelledGraph.Node, LabelledGraph.Connection, LabelledGraph.Cluster> {
    private final Id name;
    private Kind kind = Kind.DIGRAPH;
    private final LinkedHashMap<String, Node> nodes = new LinkedHashMap<>();
    private final ArrayList<Connection> connections = new ArrayList<>();
    private final ArrayList<Cluster> clusters = new ArrayList<>();

    public LabelledGraph(String name) {
      this.name = Id.of(name);
    }

    public LabelledGraph kind(Kind kind) {
      this.kind = Objects.requireNonNull(kind);
      return this;
    }

    /**
     * Fetch the node with this id, creating it if need be.
     * @param id node id
     * @return node
     */
    public Node node(String id) {
      Node ret = nodes.get(id);
      if (ret == null) {
        ret = new Node(id);
        nodes.put(id, ret);
      }
      return ret;
    }

    public Connection edge(String from, String to) {
      Connection c = new Connection(node(from), node(to));
      connections.add(c);
      return c;
    }

    public Cluster cluster(String id) {
      Cluster c = new Cluster(id == null ? null : Id.of(id));
      clusters.add(c);
      return c;
    }

    public Cluster cluster() {
      return cluster(null);
    }

    public String render() {
      return renderToString(this);
    }

    @Override
    public Iterable<Node> nodes() {
      return Collections.unmodifiableCollection(nodes.values());
    }

    @Override
    public Iterable<Connection> edges() {
      return Collections.unmodifiableList(connections);
    }

    @Override
    public Node source(Connection edge) {
      return edge.from;
    }

    @Override
    public Node target(Connection edge) {
      return edge.to;
    }

    @Override
    public Iterable<Cluster> subgraphs() {
      return Collections.unmodifiableList(clusters);
    }

    @Override
    public Iterable<Node> subgraphNodes(Cluster subgraph) {
      return Collections.unmodifiableList(subgraph.members);
    }

    @Override
    public Id graphId() {
      return name;
    }

    @Override
    public Id nodeId(Node node) {
      return node.id;
    }

    @Override
    public Text nodeLabel(Node node) {
      return node.label == null ? Labeller.super.nodeLabel(node) : node.label;
    }

    @Override
    public Style nodeStyle(Node node) {
      return node.style;
    }

    @Override
    public Optional<Text> nodeColor(Node node) {
      return Optional.ofNullable(node.color);
    }

    @Override
    public Optional<Text> nodeShape(Node node) {
      return Optional.ofNullable(node.shape);
    }

    @Override
    public Text edgeLabel(Connection edge) {
      return edge.label;
    }

    @Override
    public Style edgeStyle(Connection edge) {
      return edge.style;
    }

    @Override
    public Optional<Text> edgeColor(Connection edge) {
      return Optional.ofNullable(edge.color);
    }

    @Override
    public Arrow edgeStartArrow(Connection edge) {
      return edge.tail;
    }

    @Override
    public Arrow edgeEndArrow(Connection edge) {
      return edge.head;
    }

    @Override
    public Optional<Id> subgraphId(Cluster subgraph) {
      return Optional.ofNullable(subgraph.id);
    }

    @Override
    public Text subgraphLabel(Cluster subgraph) {
      return subgraph.label;
    }

    @Override
    public Style subgraphStyle(Cluster subgraph) {
      return subgraph.style;
    }

    @Override
    public Optional<Text> subgraphColor(Cluster subgraph) {
      return Optional.ofNullable(subgraph.color);
    }

    @Override
    public Optional<Text> subgraphShape(Cluster subgraph) {
      return Optional.ofNullable(subgraph.shape);
    }

    @Override
    public Optional<Rank> subgraphRank(Cluster subgraph) {
      return Optional.ofNullable(subgraph.rank);
    }

    @Override
    public Kind kind() {
      return kind;
    }

    public static class Node {
      private final Id id;
      private Text label;
      private Style style = Style.none;
      private Text color;
      private Text shape;

      Node(String id) {
        this.id = Id.of(id);
      }

      public Id id() {
        return id;
      }

      public Node label(String label) {
        this.label = Text.label(label);
        return this;
      }

      public Node html(String html) {
        this.label = Text.html(html);
        return this;
      }

      public Node escaped(String label) {
        this.label = Text.escaped(label);
        return this;
      }

      public Node color(String color) {
        this.color = Text.label(color);
        return this;
      }

      public Node style(Style style) {
        this.style = Objects.requireNonNull(style);
        return this;
      }

      public Node shape(String shape) {
        this.shape = Text.label(shape);
        return this;
      }

      @Override
      public String toString() {
        return "Node{" + "id='" + id.name() + '\'' + '}';
      }
    }

    public static class Connection {
      private final Node from;
      private final Node to;
      private Text label = Text.label("");
      private Style style = Style.none;
      private Text color;
      private Arrow head = Arrow.DEFAULT;
      private Arrow tail = Arrow.DEFAULT;

      Connection(Node from, Node to) {
        this.from = Objects.requireNonNull(from);
        this.to = Objects.requireNonNull(to);
      }

      public Node getFrom() {
        return from;
      }

      public Node getTo() {
        return to;
      }

      public Connection label(String label) {
        this.label = Text.label(label);
        return this;
      }

      public Connection html(String html) {
        this.label = Text.html(html);
        return this;
      }

      public Connection escaped(String label) {
        this.label = Text.escaped(label);
        return this;
      }

      public Connection color(String color) {
        this.color = Text.label(color);
        return this;
      }

      public Connection style(Style style) {
        this.style = Objects.requireNonNull(style);
        return this;
      }

      public Connection head(Arrow head) {
        this.head = Objects.requireNonNull(head);
        return this;
      }

      public Connection tail(Arrow tail) {
        this.tail = Objects.requireNonNull(tail);
        return this;
      }

      @Override
      public String toString() {
        return "Connection{" + "from=" + from + ", to=" + to + '}';
      }
    }

    public class Cluster {
      private final Id id;
      private final List<Node> members = new ArrayList<>();
      private Text label = Text.label("");
      private Style style = Style.none;
      private Text color;
      private Text shape;
      private Rank rank;

      Cluster(Id id) {
        this.id = id;
      }

      /**
       * Add members, creating the nodes if they do not exist yet.
       * @param ids node ids
       * @return this
       */
      public Cluster add(String... ids) {
        for (String id : ids) {
          members.add(node(id));
        }
        return this;
      }

      public Cluster label(String label) {
        this.label = Text.label(label);
        return this;
      }

      public Cluster color(String color) {
        this.color = Text.label(color);
        return this;
      }

      public Cluster style(Style style) {
        this.style = Objects.requireNonNull(style);
        return this;
      }

      public Cluster shape(String shape) {
        this.shape = Text.label(shape);
        return this;
      }

      public Cluster rank(Rank rank) {
        this.rank = rank;
        return this;
      }
    }
  }

  /**
   * Escape text for inclusion in an HTML-like label.
   * @param str raw text
   * @return escaped text
   */
  public static String escapeHtml(String str) {
    StringBuilder sb = null;
    for (int i = 0; i < str.length(); i++) {
      char ch = str.charAt(i);
      String rep;
      switch (ch) {
        case '&':
          rep = "&amp;";
          break;
        case '"':
          rep = "&quot;";
          break;
        case '<':
          rep = "&lt;";
          break;
        case '>':
          rep = "&gt;";
          break;
        default:
          rep = null;
          break;
      }
      if (rep != null) {
        if (sb == null) {
          sb = new StringBuilder();
          sb.append(str, 0, i);
        }
        sb.append(rep);
      } else if (sb != null) {
        sb.append(ch);
      }
    }
    return sb == null ? str : sb.toString();
  }
}
