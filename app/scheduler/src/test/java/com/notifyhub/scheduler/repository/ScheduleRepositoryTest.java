/*
 * Where: Schedule data access integration tests
 * What: Due-schedule filters, row locking and the forward-only execution stamp
 * Why: The selection SQL is the first gate against sending on the wrong day
 */
package com.notifyhub.scheduler.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.notifyhub.scheduler.AbstractPostgresContainerTest;
import com.notifyhub.scheduler.ScheduleFixtures;
import com.notifyhub.scheduler.model.Recipient;
import com.notifyhub.scheduler.model.ScheduleExecutionContext;
import com.notifyhub.scheduler.model.ScheduleLock;
import com.notifyhub.scheduler.model.ScheduleType;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@SpringBootTest
@ActiveProfiles("test")
class ScheduleRepositoryTest extends AbstractPostgresContainerTest {

  private static final LocalDate TODAY = LocalDate.of(2026, 3, 10);
  private static final LocalDate MONTH_START = LocalDate.of(2026, 3, 1);
  private static final Instant START_OF_TODAY = Instant.parse("2026-03-10T00:00:00Z");

  @Autowired private ScheduleRepository scheduleRepository;
  @Autowired private RecipientRepository recipientRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;
  @Autowired private PlatformTransactionManager transactionManager;

  private ScheduleFixtures fixtures;

  @BeforeEach
  void setUp() {
    fixtures = new ScheduleFixtures(jdbcTemplate);
    fixtures.reset();
    fixtures.department();
    fixtures.template(ScheduleFixtures.TEMPLATE_ID, "Hello {{first_name}}", "Body", true);
    fixtures.template("TPL002", "Retired", "Body", false);
  }

  @Test
  void findDueSchedulesAppliesEveryEligibilityFilter() {
    fixtures.schedule("SCH001").start(MONTH_START).time(LocalTime.of(9, 0)).insert();
    fixtures
        .schedule("SCH002")
        .start(MONTH_START)
        .time(LocalTime.of(8, 0))
        .lastExecuted(Instant.parse("2026-03-09T08:00:00Z"))
        .insert();
    fixtures.schedule("SCH003").start(MONTH_START).inactive().insert();
    fixtures.schedule("SCH004").start(MONTH_START).template("TPL002").insert();
    fixtures.schedule("SCH005").start(TODAY.plusDays(1)).insert();
    fixtures.schedule("SCH006").start(MONTH_START).end(TODAY.minusDays(1)).insert();
    fixtures.schedule("SCH007").start(MONTH_START).time(LocalTime.of(9, 30)).insert();
    fixtures
        .schedule("SCH008")
        .start(MONTH_START)
        .lastExecuted(Instant.parse("2026-03-10T08:00:00Z"))
        .insert();
    // end date and schedule time are both inclusive
    fixtures.schedule("SCH009").start(MONTH_START).end(TODAY).time(LocalTime.of(9, 5)).insert();

    final List<ScheduleExecutionContext> due =
        scheduleRepository.findDueSchedules(TODAY, LocalTime.of(9, 5), START_OF_TODAY);

    assertThat(due)
        .extracting(ScheduleExecutionContext::scheduleId)
        .containsExactly("SCH002", "SCH001", "SCH009");
    final ScheduleExecutionContext first = due.get(1);
    assertThat(first.scheduleType()).isEqualTo(ScheduleType.DAILY);
    assertThat(first.subject()).isEqualTo("Hello {{first_name}}");
    assertThat(first.departmentName()).isEqualTo(ScheduleFixtures.DEPARTMENT_NAME);
    assertThat(first.subDepartmentName()).isNull();
    assertThat(first.scheduleTime()).isEqualTo(LocalTime.of(9, 0));
    assertThat(first.startDate()).isEqualTo(MONTH_START);
  }

  @Test
  void schedulesSharingATimeAreOrderedById() {
    fixtures.schedule("SCH020").start(MONTH_START).time(LocalTime.of(9, 0)).insert();
    fixtures.schedule("SCH010").start(MONTH_START).time(LocalTime.of(9, 0)).insert();
    fixtures.schedule("SCH015").start(MONTH_START).time(LocalTime.of(9, 0)).insert();

    final List<ScheduleExecutionContext> due =
        scheduleRepository.findDueSchedules(TODAY, LocalTime.of(9, 5), START_OF_TODAY);

    assertThat(due)
        .extracting(ScheduleExecutionContext::scheduleId)
        .containsExactly("SCH010", "SCH015", "SCH020");
  }

  @Test
  void lockForExecutionReadsTheCurrentRowInsideTheTransaction() {
    fixtures.schedule("SCH001").start(MONTH_START).inactive().insert();
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);

    final Optional<ScheduleLock> lock =
        transactionTemplate.execute(status -> scheduleRepository.lockForExecution("SCH001"));
    final Optional<ScheduleLock> missing =
        transactionTemplate.execute(status -> scheduleRepository.lockForExecution("SCH404"));

    assertThat(lock).hasValueSatisfying(row -> assertThat(row.active()).isFalse());
    assertThat(missing).isEmpty();
  }

  @Test
  void advanceExecutionNeverMovesLastExecutedBackwards() {
    fixtures.schedule("SCH001").start(MONTH_START).insert();
    final Instant ranAt = Instant.parse("2026-03-10T09:05:00Z");
    final Instant next = Instant.parse("2026-03-11T09:00:00Z");

    assertThat(scheduleRepository.advanceExecution("SCH001", ranAt, next, ranAt)).isEqualTo(1);
    assertThat(
            scheduleRepository.advanceExecution(
                "SCH001", ranAt.minusSeconds(3600), next, ranAt))
        .isZero();

    final Optional<ScheduleLock> lock =
        new TransactionTemplate(transactionManager)
            .execute(status -> scheduleRepository.lockForExecution("SCH001"));
    assertThat(lock).hasValueSatisfying(row -> assertThat(row.lastExecuted()).isEqualTo(ranAt));
  }

  @Test
  void activeRecipientsExcludeInactiveUsers() {
    fixtures.user("U002", "Ben", "ben@example.com", true);
    fixtures.user("U001", "Ana", "ana@example.com", true);
    fixtures.user("U003", "Cy", "cy@example.com", false);
    fixtures.schedule("SCH001").start(MONTH_START).insert();
    fixtures.assign("SCH001", "U002", "U003", "U001");

    final List<Recipient> recipients = recipientRepository.findActiveRecipients("SCH001");

    assertThat(recipients).extracting(Recipient::userId).containsExactly("U001", "U002");
    assertThat(recipients.get(0).displayName()).isEqualTo("Ana Tester");
  }

  @Test
  void connectivityCheckSucceedsAgainstLiveStore() {
    scheduleRepository.checkConnectivity();
  }
}
