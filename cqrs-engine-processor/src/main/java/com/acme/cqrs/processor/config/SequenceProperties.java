package com.acme.cqrs.processor.config;

import com.acme.cqrs.core.ValidationException;
import com.acme.cqrs.sequence.RotateBy;
import com.acme.cqrs.sequence.SequenceSettings;
import io.micronaut.context.annotation.EachProperty;
import io.micronaut.context.annotation.Parameter;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/** One {@code sequences.<name>.*} entry. The entry name is the type code unless {@code type-code} is set. */
@EachProperty("sequences")
public class SequenceProperties {

  private final String name;
  private String typeCode;
  private String tenantCode;
  private String format;
  private String rotateBy;
  private Integer startMonth;
  private String registerDate;

  public SequenceProperties(@Parameter String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  public String getTypeCode() {
    return typeCode != null ? typeCode : name;
  }

  public void setTypeCode(String typeCode) {
    this.typeCode = typeCode;
  }

  /** Limits the entry to one tenant; null applies it to all tenants. */
  public String getTenantCode() {
    return tenantCode;
  }

  public void setTenantCode(String tenantCode) {
    this.tenantCode = tenantCode;
  }

  public String getFormat() {
    return format;
  }

  public void setFormat(String format) {
    this.format = format;
  }

  public String getRotateBy() {
    return rotateBy;
  }

  public void setRotateBy(String rotateBy) {
    this.rotateBy = rotateBy;
  }

  public Integer getStartMonth() {
    return startMonth;
  }

  public void setStartMonth(Integer startMonth) {
    this.startMonth = startMonth;
  }

  /** ISO date, {@code yyyy-MM-dd}. */
  public String getRegisterDate() {
    return registerDate;
  }

  public void setRegisterDate(String registerDate) {
    this.registerDate = registerDate;
  }

  /**
   * @throws ValidationException for an unknown rotation or a malformed register date
   */
  public SequenceSettings toSettings() {
    SequenceSettings.SequenceSettingsBuilder builder =
        SequenceSettings.builder().rotateBy(RotateBy.parse(rotateBy));
    if (format != null) {
      builder.format(format);
    }
    if (startMonth != null) {
      builder.startMonth(startMonth);
    }
    if (registerDate != null && !registerDate.isBlank()) {
      try {
        builder.registerDate(LocalDate.parse(registerDate));
      } catch (DateTimeParseException e) {
        throw new ValidationException(
            "sequences." + name + ".register-date is not an ISO date: " + registerDate);
      }
    }
    return builder.build();
  }
}
