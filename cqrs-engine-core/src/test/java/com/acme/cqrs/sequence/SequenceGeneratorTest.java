package com.acme.cqrs.sequence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.acme.cqrs.core.ValidationException;
import com.acme.cqrs.repository.memory.InMemorySequenceRepository;
import com.acme.cqrs.support.MutableClock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.LongStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SequenceGeneratorTest {

  private InMemorySequenceRepository counters;
  private InMemorySequenceSettingsRegistry settings;
  private MutableClock clock;
  private SequenceGenerator generator;

  @BeforeEach
  void setUp() {
    counters = new InMemorySequenceRepository();
    settings = new InMemorySequenceSettingsRegistry();
    clock = new MutableClock(Instant.parse("2024-05-07T10:00:00Z"));
    generator = new SequenceGenerator(counters, settings, clock);
  }

  private static SequenceRequest request(String type, Map<String, String> params, LocalDate date) {
    return SequenceRequest.builder()
        .tenantCode("ACME")
        .typeCode(type)
        .params(params)
        .date(date)
        .build();
  }

  @Nested
  @DisplayName("Counting")
  class CountingTests {

    @Test
    @DisplayName("should start a new counter at 1 and increment it")
    void testIncrements() {
      SequenceRequest req = request("invoice", Map.of(), null);

      assertThat(generator.generate(req).no()).isEqualTo(1);
      assertThat(generator.generate(req).no()).isEqualTo(2);
      assertThat(counters.current("SEQ#ACME#invoice", "none")).isEqualTo(2);
    }

    @Test
    @DisplayName("should scope counters by parameter values")
    void testScopedByParams() {
      SequenceResult a = generator.generate(request("invoice", Map.of("branch", "A"), null));
      SequenceResult b = generator.generate(request("invoice", Map.of("branch", "B"), null));

      assertThat(a.no()).isEqualTo(1);
      assertThat(b.no()).isEqualTo(1);
      assertThat(a.scopeKey()).isEqualTo("SEQ#ACME#invoice#branch=A");
    }

    @Test
    @DisplayName("should order parameters by name in the scope key")
    void testScopeKeyOrder() {
      assertThat(SequenceGenerator.scopeKey("T", "x", Map.of("z", "1", "a", "2")))
          .isEqualTo("SEQ#T#x#a=2#z=1");
    }

    @Test
    @DisplayName("should keep counters apart when only the parameter name differs")
    void testScopeKeyNames() {
      SequenceResult branch = generator.generate(request("invoice", Map.of("branch", "X"), null));
      SequenceResult region = generator.generate(request("invoice", Map.of("region", "X"), null));

      assertThat(branch.scopeKey()).isNotEqualTo(region.scopeKey());
      assertThat(branch.no()).isEqualTo(1);
      assertThat(region.no()).isEqualTo(1);
    }

    @Test
    @DisplayName("should escape separators inside parameter values")
    void testScopeKeyEscaping() {
      String joined = SequenceGenerator.scopeKey("T", "x", Map.of("a", "1#b=2"));
      String split = SequenceGenerator.scopeKey("T", "x", Map.of("a", "1", "b", "2"));

      assertThat(joined).isEqualTo("SEQ#T#x#a=1\\#b\\=2");
      assertThat(joined).isNotEqualTo(split);
      assertThat(SequenceGenerator.scopeKey("T#x", "y", Map.of()))
          .isNotEqualTo(SequenceGenerator.scopeKey("T", "x#y", Map.of()));
    }

    @Test
    @DisplayName("should hand out distinct contiguous numbers to concurrent callers")
    void testConcurrent() throws Exception {
      int callers = 8;
      int perCaller = 50;
      ExecutorService pool = Executors.newFixedThreadPool(callers);
      CountDownLatch start = new CountDownLatch(1);
      Set<Long> issued = ConcurrentHashMap.newKeySet();
      List<Future<?>> futures = new ArrayList<>();
      for (int c = 0; c < callers; c++) {
        futures.add(
            pool.submit(
                () -> {
                  start.await();
                  for (int i = 0; i < perCaller; i++) {
                    issued.add(generator.generate(request("order", Map.of(), null)).no());
                  }
                  return null;
                }));
      }
      start.countDown();
      for (Future<?> f : futures) {
        f.get(30, TimeUnit.SECONDS);
      }
      pool.shutdown();

      assertThat(issued)
          .containsExactlyInAnyOrderElementsOf(
              LongStream.rangeClosed(1, (long) callers * perCaller).boxed().collect(Collectors.toList()));
    }
  }

  @Nested
  @DisplayName("Formatting")
  class FormattingTests {

    @Test
    @DisplayName("should pad parameters and the number")
    void testPadding() {
      SequenceSettings inline = SequenceSettings.builder().format("%%code#:0>3%%-%%no#:0>2%%").build();
      SequenceRequest req = request("ticket", Map.of("code", "7"), null);
      for (int i = 0; i < 4; i++) {
        generator.generate(req, inline);
      }

      assertThat(generator.generate(req, inline).formattedNo()).isEqualTo("007-05");
    }

    @Test
    @DisplayName("should use stored settings for the type")
    void testStoredSettings() {
      settings.register("invoice", SequenceSettings.builder().format("INV-%%year%%%%month#:0>2%%-%%no#:0>4%%").build());

      SequenceResult result = generator.generate(request("invoice", Map.of(), LocalDate.of(2024, 3, 9)));

      assertThat(result.formattedNo()).isEqualTo("INV-202403-0001");
      assertThat(result.issuedAt()).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("should prefer tenant-specific settings")
    void testTenantSettings() {
      settings.register("invoice", SequenceSettings.builder().format("G-%%no%%").build());
      settings.register("ACME", "invoice", SequenceSettings.builder().format("A-%%no%%").build());

      assertThat(generator.generate(request("invoice", Map.of(), null)).formattedNo()).isEqualTo("A-1");
    }

    @Test
    @DisplayName("should reject an unknown placeholder without consuming a number")
    void testUnknownPlaceholder() {
      SequenceSettings bad = SequenceSettings.builder().format("%%branch%%-%%no%%").build();
      SequenceRequest req = request("invoice", Map.of(), null);

      assertThatThrownBy(() -> generator.generate(req, bad))
          .isInstanceOf(ValidationException.class)
          .hasMessageContaining("branch");
      assertThat(counters.current("SEQ#ACME#invoice", "none")).isZero();
    }

    @Test
    @DisplayName("should require tenant and type")
    void testRequiredFields() {
      assertThatThrownBy(() -> generator.generate(SequenceRequest.builder().typeCode("x").build()))
          .isInstanceOf(ValidationException.class);
    }
  }

  @Nested
  @DisplayName("Rotation")
  class RotationTests {

    @Test
    @DisplayName("should compute period buckets")
    void testPeriods() {
      LocalDate date = LocalDate.of(2024, 5, 7);

      assertThat(SequenceGenerator.period(rotate(RotateBy.NONE), date)).isEqualTo("none");
      assertThat(SequenceGenerator.period(rotate(RotateBy.DAILY), date)).isEqualTo("20240507");
      assertThat(SequenceGenerator.period(rotate(RotateBy.MONTHLY), date)).isEqualTo("202405");
      assertThat(SequenceGenerator.period(rotate(RotateBy.YEARLY), date)).isEqualTo("2024");
      assertThat(SequenceGenerator.period(rotate(RotateBy.FISCAL_YEARLY), date)).isEqualTo("FY2024");
    }

    @Test
    @DisplayName("should start a fresh counter at 1 in a new fiscal year")
    void testFiscalRotation() {
      SequenceSettings fiscal =
          SequenceSettings.builder().rotateBy(RotateBy.FISCAL_YEARLY).format("%%fiscal_year%%-%%no%%").build();

      SequenceResult march = generator.generate(request("po", Map.of(), LocalDate.of(2024, 3, 31)), fiscal);
      SequenceResult march2 = generator.generate(request("po", Map.of(), LocalDate.of(2024, 3, 31)), fiscal);
      SequenceResult april = generator.generate(request("po", Map.of(), LocalDate.of(2024, 4, 1)), fiscal);

      assertThat(march.formattedNo()).isEqualTo("2023-1");
      assertThat(march2.no()).isEqualTo(2);
      assertThat(april.formattedNo()).isEqualTo("2024-1");
      assertThat(april.period()).isEqualTo("FY2024");
      assertThat(counters.current("SEQ#ACME#po", "FY2023")).isEqualTo(2);
    }

    @Test
    @DisplayName("should count fiscal years from a register date")
    void testRegisterDate() {
      LocalDate registered = LocalDate.of(2020, 10, 1);

      assertThat(FiscalYears.fiscalYear(LocalDate.of(2020, 10, 1), 4, registered)).isEqualTo(1);
      assertThat(FiscalYears.fiscalYear(LocalDate.of(2021, 9, 30), 4, registered)).isEqualTo(1);
      assertThat(FiscalYears.fiscalYear(LocalDate.of(2021, 10, 1), 4, registered)).isEqualTo(2);
      assertThatThrownBy(() -> FiscalYears.fiscalYear(LocalDate.of(2020, 9, 1), 4, registered))
          .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("should honour a custom fiscal start month")
    void testStartMonth() {
      assertThat(FiscalYears.fiscalYear(LocalDate.of(2024, 6, 30), 7, null)).isEqualTo(2023);
      assertThat(FiscalYears.fiscalYear(LocalDate.of(2024, 7, 1), 7, null)).isEqualTo(2024);
    }

    @Test
    @DisplayName("should parse rotation names from configuration")
    void testParse() {
      assertThat(RotateBy.parse("fiscal_yearly")).isEqualTo(RotateBy.FISCAL_YEARLY);
      assertThat(RotateBy.parse(null)).isEqualTo(RotateBy.NONE);
      assertThatThrownBy(() -> RotateBy.parse("hourly")).isInstanceOf(ValidationException.class);
    }

    private SequenceSettings rotate(RotateBy rotateBy) {
      return SequenceSettings.builder().rotateBy(rotateBy).build();
    }
  }
}
