package com.guildcraft.crafting.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.guildcraft.crafting.model.RequestErrorCode;
import com.guildcraft.crafting.model.RequestOutcome;
import com.guildcraft.crafting.model.RequestStatus;
import java.util.EnumSet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class RequestStatusMachineTest {

  private final RequestStatusMachine machine = new RequestStatusMachine();

  @ParameterizedTest
  @CsvSource({
    "OPEN, CLAIMED, true",
    "OPEN, DENIED, true",
    "OPEN, IN_PROGRESS, false",
    "OPEN, COMPLETE, false",
    "OPEN, OPEN, false",
    "CLAIMED, IN_PROGRESS, true",
    "CLAIMED, DENIED, true",
    "CLAIMED, COMPLETE, false",
    "CLAIMED, OPEN, false",
    "CLAIMED, CLAIMED, false",
    "IN_PROGRESS, COMPLETE, true",
    "IN_PROGRESS, DENIED, true",
    "IN_PROGRESS, CLAIMED, false",
    "IN_PROGRESS, OPEN, false",
    "COMPLETE, DENIED, false",
    "COMPLETE, OPEN, false",
    "DENIED, OPEN, false",
    "DENIED, CLAIMED, false"
  })
  void followsTransitionTable(RequestStatus from, RequestStatus to, boolean allowed) {
    assertThat(machine.canTransition(from, to)).isEqualTo(allowed);
    assertThat(machine.validate(from, to).isSuccess()).isEqualTo(allowed);
  }

  @Test
  void terminalStatusesAllowNothing() {
    assertThat(machine.allowedTargets(RequestStatus.COMPLETE)).isEmpty();
    assertThat(machine.allowedTargets(RequestStatus.DENIED)).isEmpty();
    assertThat(machine.allowedTargets(RequestStatus.OPEN))
        .isEqualTo(EnumSet.of(RequestStatus.CLAIMED, RequestStatus.DENIED));
  }

  @Test
  void rejectedTransitionReportsBothEnds() {
    final RequestOutcome<RequestStatus> outcome =
        machine.validate(RequestStatus.COMPLETE, RequestStatus.CLAIMED);

    assertThat(outcome.errorCode()).isEqualTo(RequestErrorCode.INVALID_TRANSITION);
    assertThat(outcome.failure().orElseThrow().fromStatus()).isEqualTo(RequestStatus.COMPLETE);
    assertThat(outcome.failure().orElseThrow().toStatus()).isEqualTo("claimed");
  }

  @Test
  void rawTargetIsParsedBeforeChecking() {
    assertThat(machine.validate(RequestStatus.OPEN, "claimed").value())
        .contains(RequestStatus.CLAIMED);
  }

  @Test
  void rawTargetWithOtherCasingOrPaddingIsRejected() {
    final RequestOutcome<RequestStatus> upper = machine.validate(RequestStatus.OPEN, " CLAIMED ");
    final RequestOutcome<RequestStatus> mixed = machine.validate(RequestStatus.OPEN, "Denied");

    assertThat(upper.errorCode()).isEqualTo(RequestErrorCode.INVALID_TRANSITION);
    assertThat(upper.failure().orElseThrow().toStatus()).isEqualTo(" CLAIMED ");
    assertThat(mixed.errorCode()).isEqualTo(RequestErrorCode.INVALID_TRANSITION);
  }

  @Test
  void legacyAndUnknownTargetsFailClosed() {
    final RequestOutcome<RequestStatus> cancelled =
        machine.validate(RequestStatus.OPEN, "cancelled");
    final RequestOutcome<RequestStatus> blank = machine.validate(RequestStatus.CLAIMED, " ");

    assertThat(cancelled.errorCode()).isEqualTo(RequestErrorCode.INVALID_TRANSITION);
    assertThat(cancelled.failure().orElseThrow().toStatus()).isEqualTo("cancelled");
    assertThat(blank.errorCode()).isEqualTo(RequestErrorCode.INVALID_TRANSITION);
  }
}
