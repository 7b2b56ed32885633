package ca.gc.cra.fmtlog.domain.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.fmtlog.domain.format.FormatTemplate.Binding;
import ca.gc.cra.fmtlog.domain.format.FormatTemplate.Literal;
import ca.gc.cra.fmtlog.domain.format.FormatTemplate.Placeholder;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class FormatTemplateTest {

  @Test
  void splitsLiteralsAndAutomaticPlaceholders() {
    FormatTemplate template = FormatTemplate.parse("Hello, {}!");

    List<FormatTemplate.Segment> segments = template.segments();
    assertEquals(3, segments.size());
    assertEquals(new Literal("Hello, "), segments.get(0));
    Placeholder placeholder = assertInstanceOf(Placeholder.class, segments.get(1));
    assertEquals(Binding.AUTOMATIC, placeholder.binding());
    assertEquals(0, placeholder.index());
    assertEquals(FormatSpec.EMPTY, placeholder.spec());
    assertEquals(new Literal("!"), segments.get(2));
  }

  @Test
  void automaticPlaceholdersTakeSequentialIndices() {
    FormatTemplate template = FormatTemplate.parse("{} + {} = {}");

    List<Integer> indices = template.segments().stream()
        .filter(Placeholder.class::isInstance)
        .map(segment -> ((Placeholder) segment).index())
        .toList();
    assertEquals(List.of(0, 1, 2), indices);
  }

  @Test
  void doubledBracesAreLiteral() {
    FormatTemplate template = FormatTemplate.parse("{{}} {}");

    assertEquals(new Literal("{} "), template.segments().get(0));
    assertEquals(2, template.segments().size());
  }

  @Test
  void positionalAndNamedPlaceholdersMayMix() {
    FormatTemplate template = FormatTemplate.parse("{1} comes before {0}, said {who:>5}");

    Placeholder first = (Placeholder) template.segments().get(0);
    assertEquals(Binding.POSITIONAL, first.binding());
    assertEquals(1, first.index());
    Placeholder named = (Placeholder) template.segments().get(4);
    assertEquals(Binding.NAMED, named.binding());
    assertEquals("who", named.name());
    assertEquals(5, named.spec().width());
    assertEquals(Set.of("who"), template.placeholderNames());
  }

  @Test
  void reservedStyleNamesAreAccepted() {
    FormatTemplate template = FormatTemplate.parse("[{%time:%H:%M}] {%message}");

    assertEquals(Set.of("%time", "%message"), template.placeholderNames());
    Placeholder time = (Placeholder) template.segments().get(1);
    assertTrue(time.spec().isTimePattern());
    assertEquals("%H:%M", time.spec().timePattern());
  }

  @Test
  void mixingAutomaticAndExplicitIsRejected() {
    FormatException ex = assertThrows(FormatException.class, () -> FormatTemplate.parse("{} and {0}"));
    assertEquals(FormatException.Kind.MALFORMED_SPECIFIER, ex.kind());

    ex = assertThrows(FormatException.class, () -> FormatTemplate.parse("{name} and {}"));
    assertEquals(FormatException.Kind.MALFORMED_SPECIFIER, ex.kind());
  }

  @Test
  void unbalancedBracesAreRejected() {
    for (String source : List.of("open {", "close }", "nested {a{b}", "{-1}", "{:q}")) {
      FormatException ex = assertThrows(FormatException.class, () -> FormatTemplate.parse(source), source);
      assertEquals(FormatException.Kind.MALFORMED_SPECIFIER, ex.kind(), source);
    }
  }

  @Test
  void plainTextHasNoPlaceholders() {
    FormatTemplate template = FormatTemplate.parse("just text");

    assertFalse(template.hasPlaceholders());
    assertEquals("just text", template.toString());
  }

  @Test
  void equalityFollowsSource() {
    assertEquals(FormatTemplate.parse("{} x"), FormatTemplate.parse("{} x"));
    assertEquals(FormatTemplate.parse("{} x").hashCode(), FormatTemplate.parse("{} x").hashCode());
  }
}
