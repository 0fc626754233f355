package com.acme.cqrs.sequence;

import com.acme.cqrs.core.ValidationException;
import com.acme.cqrs.domain.AggregateKey;
import com.acme.cqrs.repository.SequenceRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mints human-readable business numbers from atomic counters. A counter is identified by its scope
 * (tenant, type and parameter values) and its rotation period; a new period starts a new counter,
 * so rotation never resets an existing row.
 */
public class SequenceGenerator {

  private static final Logger LOG = LoggerFactory.getLogger(SequenceGenerator.class);

  public static final String SCOPE_PREFIX = "SEQ";
  public static final String NO_ROTATION = "none";

  private static final DateTimeFormatter DAILY = DateTimeFormatter.ofPattern("yyyyMMdd");
  private static final DateTimeFormatter MONTHLY = DateTimeFormatter.ofPattern("yyyyMM");
  private static final DateTimeFormatter YEARLY = DateTimeFormatter.ofPattern("yyyy");

  private final SequenceRepository sequenceRepository;
  private final SequenceSettingsRegistry settingsRegistry;
  private final Clock clock;

  public SequenceGenerator(
      SequenceRepository sequenceRepository, SequenceSettingsRegistry settingsRegistry, Clock clock) {
    this.sequenceRepository = sequenceRepository;
    this.settingsRegistry = settingsRegistry;
    this.clock = clock;
  }

  /** Next number using the stored settings of the request's type, or the defaults when none. */
  public SequenceResult generate(SequenceRequest request) {
    validate(request);
    SequenceSettings settings =
        settingsRegistry
            .find(request.getTenantCode(), request.getTypeCode())
            .orElseGet(() -> SequenceSettings.builder().build());
    return generate(request, settings);
  }

  /** Next number using settings supplied with the call instead of stored ones. */
  public SequenceResult generate(SequenceRequest request, SequenceSettings settings) {
    validate(request);
    LocalDate date = request.getDate() != null ? request.getDate() : LocalDate.now(clock);
    String scopeKey = scopeKey(request.getTenantCode(), request.getTypeCode(), request.getParams());
    return next(scopeKey, period(settings, date), request.getParams(), settings, date);
  }

  /**
   * Increment the counter of {@code (scopeKey, period)} and format the new value.
   *
   * @throws ValidationException when the template names an unknown variable
   */
  public SequenceResult next(
      String scopeKey,
      String period,
      Map<String, String> params,
      SequenceSettings settings,
      LocalDate date) {
    Map<String, Object> variables = new LinkedHashMap<>();
    if (params != null) {
      variables.putAll(params);
    }
    variables.put("no", 0L);
    variables.put("year", date.getYear());
    variables.put("month", date.getMonthValue());
    variables.put("day", date.getDayOfMonth());
    variables.put(
        "fiscal_year",
        FiscalYears.fiscalYear(date, settings.getStartMonth(), settings.getRegisterDate()));

    // a bad template must not consume a number
    SequenceFormatter.format(settings.getFormat(), variables);

    long no = sequenceRepository.increment(scopeKey, period, 1);
    variables.put("no", no);
    String formatted = SequenceFormatter.format(settings.getFormat(), variables);
    Instant issuedAt = clock.instant();
    LOG.debug("Issued sequence: scope={} period={} no={} formatted={}", scopeKey, period, no, formatted);
    return new SequenceResult(no, formatted, issuedAt, scopeKey, period);
  }

  /**
   * {@code SEQ#<tenant>#<type>} followed by one {@code #name=value} segment per parameter, ordered
   * by parameter name. {@code \}, {@code #} and {@code =} inside any component are escaped with a
   * backslash so distinct scopes never share a key.
   */
  public static String scopeKey(String tenantCode, String typeCode, Map<String, String> params) {
    StringBuilder key =
        new StringBuilder(SCOPE_PREFIX)
            .append(AggregateKey.KEY_SEPARATOR)
            .append(escape(tenantCode))
            .append(AggregateKey.KEY_SEPARATOR)
            .append(escape(typeCode));
    if (params != null) {
      new TreeMap<>(params)
          .forEach(
              (name, value) ->
                  key.append(AggregateKey.KEY_SEPARATOR)
                      .append(escape(name))
                      .append('=')
                      .append(escape(value)));
    }
    return key.toString();
  }

  private static String escape(String component) {
    if (component == null) {
      return "";
    }
    StringBuilder escaped = new StringBuilder(component.length());
    for (char c : component.toCharArray()) {
      if (c == '\\' || c == '#' || c == '=') {
        escaped.append('\\');
      }
      escaped.append(c);
    }
    return escaped.toString();
  }

  /** Rotation bucket of {@code date}. */
  public static String period(SequenceSettings settings, LocalDate date) {
    return switch (settings.getRotateBy()) {
      case NONE -> NO_ROTATION;
      case DAILY -> DAILY.format(date);
      case MONTHLY -> MONTHLY.format(date);
      case YEARLY -> YEARLY.format(date);
      case FISCAL_YEARLY ->
          "FY" + FiscalYears.fiscalYear(date, settings.getStartMonth(), settings.getRegisterDate());
    };
  }

  private static void validate(SequenceRequest request) {
    if (request.getTenantCode() == null || request.getTenantCode().isBlank()) {
      throw new ValidationException("tenantCode is required");
    }
    if (request.getTypeCode() == null || request.getTypeCode().isBlank()) {
      throw new ValidationException("typeCode is required");
    }
  }
}
