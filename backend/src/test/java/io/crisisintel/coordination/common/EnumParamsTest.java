package io.crisisintel.coordination.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.crisisintel.coordination.exception.InvalidRequestException;
import io.crisisintel.coordination.request.RequestStatus;
import org.junit.jupiter.api.Test;

class EnumParamsTest {

  @Test
  void parse_acceptsLowerAndUpperCase() {
    assertThat(EnumParams.parse(RequestStatus.class, "status", "accepted"))
        .isEqualTo(RequestStatus.ACCEPTED);
    assertThat(EnumParams.parse(RequestStatus.class, "status", " PENDING "))
        .isEqualTo(RequestStatus.PENDING);
  }

  @Test
  void parse_blankValue_returnsNull() {
    assertThat(EnumParams.parse(RequestStatus.class, "status", null)).isNull();
    assertThat(EnumParams.parse(RequestStatus.class, "status", "  ")).isNull();
  }

  @Test
  void parse_unknownValue_listsAllowedValues() {
    assertThatThrownBy(() -> EnumParams.parse(RequestStatus.class, "status", "approved"))
        .isInstanceOf(InvalidRequestException.class)
        .hasMessageContaining("pending")
        .hasMessageContaining("got: approved");
  }
}
