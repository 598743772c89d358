package com.marketdesk.marketdata.render;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.marketdesk.marketdata.client.ValidationException;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class ExpiryParserTest {

  @Test
  void parsesTwoDigitYearsAroundPivot() {
    assertThat(ExpiryParser.parse("01/15/25")).isEqualTo(LocalDate.of(2025, 1, 15));
    assertThat(ExpiryParser.parse("1/5/25")).isEqualTo(LocalDate.of(2025, 1, 5));
    assertThat(ExpiryParser.parse("01/15/69")).isEqualTo(LocalDate.of(2069, 1, 15));
    assertThat(ExpiryParser.parse("01/15/70")).isEqualTo(LocalDate.of(1970, 1, 15));
    assertThat(ExpiryParser.toIsoDate("12/19/25")).isEqualTo("2025-12-19");
  }

  @Test
  void rejectsOtherShapes() {
    for (String bad : new String[] {"1/15/2025", "2025-01-15", "01-15-25", "", "abc"}) {
      assertThatThrownBy(() -> ExpiryParser.parse(bad))
          .as(bad)
          .isInstanceOf(ValidationException.class)
          .hasMessage(ExpiryParser.MESSAGE);
    }
    assertThatThrownBy(() -> ExpiryParser.parse(null)).isInstanceOf(ValidationException.class);
  }

  @Test
  void rejectsImpossibleDates() {
    assertThatThrownBy(() -> ExpiryParser.parse("13/40/25"))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> ExpiryParser.parse("02/30/25"))
        .isInstanceOf(ValidationException.class);
  }
}
