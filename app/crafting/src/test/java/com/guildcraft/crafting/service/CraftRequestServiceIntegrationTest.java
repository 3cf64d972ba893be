/*
 * Where: CraftRequestService integration tests
 * What: Creation, duplicate suppression, denial, admin overrides, cascades and read paths
 * Why: These flows span several writers and only hold together inside one transaction
 */
package com.guildcraft.crafting.service;

import static com.guildcraft.crafting.service.CraftRequestFixtures.newRequest;
import static org.assertj.core.api.Assertions.assertThat;

import com.guildcraft.crafting.AbstractPostgresContainerTest;
import com.guildcraft.crafting.MutableClock;
import com.guildcraft.crafting.model.AuditEntry;
import com.guildcraft.crafting.model.CraftRequest;
import com.guildcraft.crafting.model.CrafterActivity;
import com.guildcraft.crafting.model.NewCraftRequest;
import com.guildcraft.crafting.model.ProfessionStatusCount;
import com.guildcraft.crafting.model.RequestErrorCode;
import com.guildcraft.crafting.model.RequestOutcome;
import com.guildcraft.crafting.model.RequestStatus;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class CraftRequestServiceIntegrationTest extends AbstractPostgresContainerTest {

  private static final Instant START = Instant.parse("2026-03-01T12:00:00Z");
  private static final Duration COMPLETION_TIMEOUT = Duration.ofSeconds(10);

  @TestConfiguration
  static class MutableClockConfig {
    @Bean(name = "testClock")
    @Primary
    MutableClock clock() {
      return new MutableClock(START);
    }
  }

  @Autowired private CraftRequestService service;

  @Autowired private ClaimService claimService;

  @Autowired private FulfillmentService fulfillmentService;

  @Autowired private Clock clock;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    truncateAll(jdbcTemplate);
    mutableClock().set(START);
  }

  @Test
  void createStoresOpenRequestWithCreatedAudit() {
    final CraftRequest created = service.create(newRequest("item-1", 3)).orElseThrow();

    assertThat(created.status()).isEqualTo(RequestStatus.OPEN);
    assertThat(created.quantityRequested()).isEqualTo(3);
    assertThat(created.quantityCompleted()).isZero();
    assertThat(created.materialsRequired()).containsEntry("iron-bar", 4);
    assertThat(created.materialsProvidedByRequester()).isEmpty();
    assertThat(created.claimedBy()).isNull();
    assertThat(created.createdAt()).isEqualTo(START);
    assertThat(created.auditTrail()).hasSize(1);
    final AuditEntry entry = created.auditTrail().get(0);
    assertThat(entry.action()).isEqualTo("created");
    assertThat(entry.actorId()).isEqualTo("requester-1");
    assertThat(entry.details()).containsEntry("quantityRequested", 3);
  }

  @Test
  void identicalSubmissionInsideWindowIsRejected() {
    service.create(newRequest("item-dup")).orElseThrow();
    mutableClock().advance(Duration.ofSeconds(2));

    final RequestOutcome<CraftRequest> second = service.create(newRequest("item-dup"));

    assertThat(second.errorCode()).isEqualTo(RequestErrorCode.DUPLICATE_SUBMISSION);
    assertThat(countTable(jdbcTemplate, "craft_requests")).isEqualTo(1);
    assertThat(countTable(jdbcTemplate, "request_audit")).isEqualTo(1);
  }

  @Test
  void identicalSubmissionAfterWindowIsAccepted() {
    service.create(newRequest("item-dup")).orElseThrow();
    mutableClock().advance(Duration.ofSeconds(6));

    assertThat(service.create(newRequest("item-dup")).isSuccess()).isTrue();
    assertThat(countTable(jdbcTemplate, "craft_requests")).isEqualTo(2);
  }

  @Test
  void submissionForAnotherCharacterIsNotDuplicate() {
    service.create(newRequest("item-dup")).orElseThrow();
    final NewCraftRequest otherCharacter =
        new NewCraftRequest(
            "requester-1",
            "Brom",
            "blacksmithing",
            "chest",
            "item-dup",
            "Runed Breastplate",
            1,
            Map.of(),
            Map.of(),
            false);

    assertThat(service.create(otherCharacter).isSuccess()).isTrue();
  }

  @Test
  void racingDoubleSubmitCreatesOneRequest() throws Exception {
    final int submitters = 2;
    final CountDownLatch start = new CountDownLatch(1);
    final CountDownLatch done = new CountDownLatch(submitters);
    final List<RequestOutcome<CraftRequest>> outcomes = new CopyOnWriteArrayList<>();
    final List<Throwable> errors = new CopyOnWriteArrayList<>();
    final ExecutorService executor = Executors.newFixedThreadPool(submitters);

    try {
      for (int i = 0; i < submitters; i++) {
        executor.submit(
            () -> {
              try {
                start.await(COMPLETION_TIMEOUT.toSeconds(), TimeUnit.SECONDS);
                outcomes.add(service.create(newRequest("item-race")));
              } catch (Throwable ex) {
                errors.add(ex);
              } finally {
                done.countDown();
              }
            });
      }
      start.countDown();
      assertThat(done.await(COMPLETION_TIMEOUT.toSeconds(), TimeUnit.SECONDS)).isTrue();
    } finally {
      executor.shutdownNow();
    }

    assertThat(errors).isEmpty();
    assertThat(outcomes).filteredOn(RequestOutcome::isSuccess).hasSize(1);
    assertThat(outcomes)
        .filteredOn(outcome -> outcome.errorCode() == RequestErrorCode.DUPLICATE_SUBMISSION)
        .hasSize(1);
    assertThat(countTable(jdbcTemplate, "craft_requests")).isEqualTo(1);
  }

  @Test
  void denyClearsClaimAndRecordsReason() {
    final long id = service.create(newRequest("item-deny")).orElseThrow().id();
    claimService.claim(id, "crafter-1", "Hammerhand").orElseThrow();

    final CraftRequest denied =
        service.transition(id, "admin-1", "denied", "materials unavailable").orElseThrow();

    assertThat(denied.status()).isEqualTo(RequestStatus.DENIED);
    assertThat(denied.denyReason()).isEqualTo("materials unavailable");
    assertThat(denied.claimedBy()).isNull();
    assertThat(denied.claimedAt()).isNull();
    final AuditEntry entry = denied.auditTrail().get(denied.auditTrail().size() - 1);
    assertThat(entry.action()).isEqualTo("denied");
    assertThat(entry.details())
        .containsEntry("reason", "materials unavailable")
        .containsEntry("previousClaimant", "crafter-1");
  }

  @Test
  void denyWithoutReasonUsesDefaultAndTerminalCannotBeDeniedAgain() {
    final long id = service.create(newRequest("item-deny-default")).orElseThrow().id();

    final CraftRequest denied = service.deny(id, "requester-1", null).orElseThrow();

    assertThat(denied.denyReason()).isEqualTo("denied");
    assertThat(service.deny(id, "requester-1", "again").errorCode())
        .isEqualTo(RequestErrorCode.INVALID_TRANSITION);
    assertThat(service.findById(id).orElseThrow().auditTrail()).hasSize(2);
  }

  @Test
  void reopenReturnsFinishedRequestToPool() {
    final long id = service.create(newRequest("item-reopen")).orElseThrow().id();
    claimService.claim(id, "crafter-1", "Hammerhand").orElseThrow();
    claimService.start(id, "crafter-1").orElseThrow();
    fulfillmentService.applyCompletion(id, "crafter-1", null).orElseThrow();

    final CraftRequest reopened = service.reopen(id, "admin-1").orElseThrow();

    assertThat(reopened.status()).isEqualTo(RequestStatus.OPEN);
    assertThat(reopened.completedBy()).isNull();
    assertThat(reopened.claimedBy()).isNull();
    final AuditEntry entry = reopened.auditTrail().get(reopened.auditTrail().size() - 1);
    assertThat(entry.action()).isEqualTo("reopened");
    assertThat(entry.details()).containsEntry("previousStatus", "complete");
    assertThat(service.reopen(999_999L, "admin-1").errorCode())
        .isEqualTo(RequestErrorCode.NOT_FOUND);
  }

  @Test
  void auditTrailKeepsInsertionOrder() {
    final long id = service.create(newRequest("item-audit", 2)).orElseThrow().id();
    claimService.claim(id, "crafter-1", "Hammerhand").orElseThrow();
    claimService.release(id, "crafter-1").orElseThrow();
    claimService.claim(id, "crafter-2", "Anvil").orElseThrow();
    service.appendAudit(id, "note", "admin-1", Map.of("text", "rush order")).orElseThrow();

    final List<AuditEntry> trail = service.findById(id).orElseThrow().auditTrail();

    assertThat(trail)
        .extracting(AuditEntry::action)
        .containsExactly("created", "claimed", "released", "claimed", "note");
    assertThat(trail)
        .extracting(AuditEntry::sequence)
        .isSorted()
        .doesNotHaveDuplicates();
  }

  @Test
  void appendAuditBumpsUpdatedAtAndRejectsUnknownRequest() {
    final long id = service.create(newRequest("item-note")).orElseThrow().id();
    mutableClock().advance(Duration.ofMinutes(1));

    final CraftRequest noted =
        service.appendAudit(id, "note", "admin-1", Map.of()).orElseThrow();

    assertThat(noted.updatedAt()).isEqualTo(START.plus(Duration.ofMinutes(1)));
    assertThat(service.appendAudit(999_999L, "note", "admin-1", Map.of()).errorCode())
        .isEqualTo(RequestErrorCode.NOT_FOUND);
  }

  @Test
  void appendAuditKeepsNullDetailValues() {
    final long id = service.create(newRequest("item-null-note")).orElseThrow().id();
    final Map<String, Object> details = new LinkedHashMap<>();
    details.put("comment", null);
    details.put("channel", "guild-orders");

    final CraftRequest noted = service.appendAudit(id, "note", "admin-1", details).orElseThrow();

    final AuditEntry note = noted.auditTrail().get(1);
    assertThat(note.action()).isEqualTo("note");
    assertThat(note.details()).containsKey("comment").containsEntry("channel", "guild-orders");
    assertThat(note.details().get("comment")).isNull();
    assertThat(service.findById(id).orElseThrow().auditTrail()).hasSize(2);
  }

  @Test
  void mutationsWithoutActorAreRejectedBeforeAnyWrite() {
    final long id = service.create(newRequest("item-no-actor")).orElseThrow().id();

    assertThat(service.deny(id, null, "spam").errorCode())
        .isEqualTo(RequestErrorCode.MISSING_FIELD);
    assertThat(service.reopen(id, " ").errorCode()).isEqualTo(RequestErrorCode.MISSING_FIELD);
    assertThat(service.appendAudit(id, "note", null, Map.of()).failure().orElseThrow().field())
        .isEqualTo("actorId");

    final CraftRequest current = service.findById(id).orElseThrow();
    assertThat(current.status()).isEqualTo(RequestStatus.OPEN);
    assertThat(current.auditTrail()).extracting(AuditEntry::action).containsExactly("created");
  }

  @Test
  void cascadeDeniesOnlyNonTerminalRequestsOfCharacter() {
    final long open = service.create(newRequest("item-a")).orElseThrow().id();
    final long claimed = service.create(newRequest("item-b")).orElseThrow().id();
    final long done = service.create(newRequest("item-c")).orElseThrow().id();
    claimService.claim(claimed, "crafter-1", "Hammerhand").orElseThrow();
    claimService.claim(done, "crafter-1", "Hammerhand").orElseThrow();
    claimService.start(done, "crafter-1").orElseThrow();
    fulfillmentService.applyCompletion(done, "crafter-1", null).orElseThrow();

    final int cancelled = service.cascadeDeleteCharacter("requester-1", "Thalia", "requester-1");

    assertThat(cancelled).isEqualTo(2);
    final CraftRequest cancelledOpen = service.findById(open).orElseThrow();
    assertThat(cancelledOpen.status()).isEqualTo(RequestStatus.DENIED);
    assertThat(cancelledOpen.denyReason()).isEqualTo("character deleted");
    assertThat(cancelledOpen.auditTrail())
        .extracting(AuditEntry::action)
        .endsWith("cancelled_character_deleted");
    assertThat(service.findById(claimed).orElseThrow().claimedBy()).isNull();
    assertThat(service.findById(done).orElseThrow().status()).isEqualTo(RequestStatus.COMPLETE);
    assertThat(service.cascadeDeleteCharacter("requester-1", "Thalia")).isZero();
  }

  @Test
  void requesterListingIsNewestFirstFilteredAndLimited() {
    final long first = service.create(newRequest("item-1")).orElseThrow().id();
    mutableClock().advance(Duration.ofSeconds(10));
    final long second = service.create(newRequest("item-2")).orElseThrow().id();
    mutableClock().advance(Duration.ofSeconds(10));
    final long third = service.create(newRequest("item-3")).orElseThrow().id();
    service.deny(second, "requester-1", null).orElseThrow();

    assertThat(service.findByRequester("requester-1", null, 0))
        .extracting(CraftRequest::id)
        .containsExactly(third, second, first);
    assertThat(service.findByRequester("requester-1", EnumSet.of(RequestStatus.OPEN), 0))
        .extracting(CraftRequest::id)
        .containsExactly(third, first);
    assertThat(service.findByRequester("requester-1", null, 1)).hasSize(1);
    assertThat(service.findByRequester("requester-1", null, 0).get(0).auditTrail()).isNotEmpty();
  }

  @Test
  void crafterQueueListsInProgressFirst() {
    final long claimedEarly = service.create(newRequest("item-1")).orElseThrow().id();
    final long started = service.create(newRequest("item-2")).orElseThrow().id();
    claimService.claim(claimedEarly, "crafter-1", "Hammerhand").orElseThrow();
    mutableClock().advance(Duration.ofSeconds(5));
    claimService.claim(started, "crafter-1", "Hammerhand").orElseThrow();
    claimService.start(started, "crafter-1").orElseThrow();

    assertThat(service.findClaimedBy("crafter-1"))
        .extracting(CraftRequest::id)
        .containsExactly(started, claimedEarly);
    assertThat(service.findClaimedBy("crafter-2")).isEmpty();
  }

  @Test
  void professionQueuesAndSummaries() {
    final long older = service.create(newRequest("item-1")).orElseThrow().id();
    mutableClock().advance(Duration.ofSeconds(5));
    final long newer = service.create(newRequest("item-2")).orElseThrow().id();
    final long worked = service.create(newRequest("item-3")).orElseThrow().id();
    claimService.claim(worked, "crafter-1", "Hammerhand").orElseThrow();

    assertThat(service.findOpenQueue("blacksmithing"))
        .extracting(CraftRequest::id)
        .containsExactly(older, newer);
    assertThat(service.findByProfession("blacksmithing", EnumSet.of(RequestStatus.CLAIMED)))
        .extracting(CraftRequest::id)
        .containsExactly(worked);
    assertThat(service.findByCharacter("Thalia")).hasSize(3);
    assertThat(service.summarizeActiveWork())
        .containsExactlyInAnyOrder(
            new ProfessionStatusCount("blacksmithing", RequestStatus.OPEN, 2),
            new ProfessionStatusCount("blacksmithing", RequestStatus.CLAIMED, 1));
  }

  @Test
  void crafterActivityCountsActiveAndCompletedWork() {
    final long active = service.create(newRequest("item-1")).orElseThrow().id();
    final long finished = service.create(newRequest("item-2")).orElseThrow().id();
    claimService.claim(active, "crafter-1", "Hammerhand").orElseThrow();
    claimService.claim(finished, "crafter-1", "Hammerhand").orElseThrow();
    claimService.start(finished, "crafter-1").orElseThrow();
    fulfillmentService.applyCompletion(finished, "crafter-1", null).orElseThrow();

    final List<CrafterActivity> activity = service.crafterActivity();

    assertThat(activity).hasSize(1);
    final CrafterActivity crafter = activity.get(0);
    assertThat(crafter.crafterId()).isEqualTo("crafter-1");
    assertThat(crafter.displayName()).isEqualTo("Hammerhand");
    assertThat(crafter.professions()).containsExactly("blacksmithing");
    assertThat(crafter.activeCount()).isEqualTo(1);
    assertThat(crafter.completedCount()).isEqualTo(1);
  }

  private MutableClock mutableClock() {
    return (MutableClock) clock;
  }
}
