package com.example.residency_scheduler.enums;

import lombok.Getter;

/**
 * Clinical stations and leave pseudo-stations. The ordinal is the compact id stored in the
 * schedule matrix, so constants must only ever be appended.
 */
@Getter
public enum StationCode {
  ORIENTATION("Orientation", "Orientation", null, false),
  MATERNITY_INTRO("Maternity", "Maternity", null, false),
  HRP_A("HRP A", "HRP", Department.A, false),
  HRP_B("HRP B", "HRP", Department.B, false),
  BIRTH("Birth", "Birth", null, false),
  GYNECOLOGY_A("Gynecology A", "Gynecology", Department.A, false),
  GYNECOLOGY_B("Gynecology B", "Gynecology", Department.B, false),
  MATERNITY_ER("Maternity ER", "Maternity ER", null, false),
  WOMENS_ER("Womens ER", "Womens ER", null, false),
  GYNECOLOGY_DAY("Gynecology Day", "Gynecology Day", null, false),
  MIDWIFERY_DAY("Midwifery Day", "Midwifery Day", null, false),
  BASIC_SCIENCES("Basic Sciences", "Basic Sciences", null, false),
  ROTATION_A("Rotation A", "Rotation A", null, false),
  STAGE_A("Stage A", "Stage A", null, false),
  ROTATION_B("Rotation B", "Rotation B", null, false),
  STAGE_B("Stage B", "Stage B", null, false),
  DEPARTMENT("Department", "Department", null, false),
  IVF("IVF", "IVF", null, false),
  GYNECO_ONCOLOGY("Gyneco-Oncology", "Gyneco-Oncology", null, false),
  ROTATION("Rotation", "Rotation", null, false),
  MATERNITY_ER_SUPERVISOR("Maternity ER Supervisor", "Maternity ER Supervisor", null, false),
  MATERNITY_LEAVE("Maternity Leave", "Maternity Leave", null, true),
  UNPAID_LEAVE("Unpaid Leave", "Unpaid Leave", null, true),
  SICK_LEAVE("Sick Leave", "Sick Leave", null, true);

  public static final int UNASSIGNED = -1;

  private static final StationCode[] BY_ID = values();

  private final String displayName;
  private final String logicalStation;
  // null means shared by both departments
  private final Department department;
  private final boolean leave;

  StationCode(String displayName, String logicalStation, Department department, boolean leave) {
      this.displayName = displayName;
      this.logicalStation = logicalStation;
      this.department = department;
      this.leave = leave;
  }

  public int id() {
      return ordinal();
  }

  public boolean isOpenTo(Department traineeDepartment) {
      return department == null || department == traineeDepartment;
  }

  public static StationCode fromId(int id) {
      if (id == UNASSIGNED) {
          return null;
      }
      return BY_ID[id];
  }

  public static int count() {
      return BY_ID.length;
  }
}
