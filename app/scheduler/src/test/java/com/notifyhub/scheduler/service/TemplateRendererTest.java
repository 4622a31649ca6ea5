package com.notifyhub.scheduler.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class TemplateRendererTest {

  private final TemplateRenderer renderer = new TemplateRenderer();

  @Test
  void replacesPlaceholdersWithOptionalInnerWhitespace() {
    final String rendered =
        renderer.render(
            "Hello {{first_name}}, {{ department_name }} meets at {{meeting_time  }}",
            Map.of("first_name", "Ana", "department_name", "Ops", "meeting_time", "10:00"));

    assertThat(rendered).isEqualTo("Hello Ana, Ops meets at 10:00");
  }

  @Test
  void keepsUnknownPlaceholdersVerbatim() {
    assertThat(renderer.render("Due {{deadline}} for {{first_name}}", Map.of("first_name", "Ana")))
        .isEqualTo("Due {{deadline}} for Ana");
  }

  @Test
  void replacesEveryOccurrenceOfTheSameName() {
    assertThat(renderer.render("{{x}}-{{x}}", Map.of("x", "1"))).isEqualTo("1-1");
  }

  @Test
  void valuesAreInsertedLiterally() {
    // '$' and '\' in values must not be read as regex group references
    assertThat(renderer.render("Cost {{amount}}", Map.of("amount", "$5 \\ unit")))
        .isEqualTo("Cost $5 \\ unit");
  }

  @Test
  void malformedPlaceholdersAreLeftAlone() {
    assertThat(renderer.render("{{first name}} {first_name} {{}}", Map.of("first_name", "Ana")))
        .isEqualTo("{{first name}} {first_name} {{}}");
  }

  @Test
  void nullAndEmptyTextPassThrough() {
    assertThat(renderer.render(null, Map.of())).isNull();
    assertThat(renderer.render("", Map.of())).isEmpty();
  }
}
