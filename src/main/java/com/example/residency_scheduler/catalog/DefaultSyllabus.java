package com.example.residency_scheduler.catalog;

import java.time.LocalDate;
import java.time.Month;
import java.util.ArrayList;
import java.util.List;

import static com.example.residency_scheduler.enums.StationCode.*;

/**
 * The syllabus version every fresh catalog starts with. Its capacity rules carry ceilings only; the
 * staffed variant adds the ward minimums a full cohort is expected to cover, and is opted into per
 * deployment because a small roster cannot meet them.
 */
public final class DefaultSyllabus {
    public static final String VERSION = "2024.1";
    public static final String STAFFED_VERSION = "2024.1-staffed";
    public static final LocalDate EFFECTIVE_FROM = LocalDate.of(2020, 1, 1);
    public static final int WITHIN_SYLLABUS_LEAVE_CAP = 6;

    private DefaultSyllabus() {
    }

    public static SyllabusRuleSet ruleSet() {
        return ruleSet(false);
    }

    public static SyllabusRuleSet ruleSet(boolean staffingFloors) {
        return new SyllabusRuleSet(staffingFloors ? STAFFED_VERSION : VERSION, EFFECTIVE_FROM, null,
            rules(staffingFloors), DEPARTMENT, WITHIN_SYLLABUS_LEAVE_CAP);
    }

    public static List<StationRule> rules() {
        return rules(false);
    }

    public static List<StationRule> rules(boolean staffingFloors) {
        int floor = staffingFloors ? 1 : 0;
        List<StationRule> rules = new ArrayList<>();

        // Model A / Model B months
        rules.add(StationRule.duration(ORIENTATION, 1, 1, false));
        rules.add(StationRule.duration(MATERNITY_INTRO, 1, 1, false));
        rules.add(StationRule.duration(HRP_A, 6, 6, true));
        rules.add(StationRule.duration(HRP_B, 6, 6, true));
        rules.add(StationRule.duration(BIRTH, 6, 6, true));
        rules.add(StationRule.duration(GYNECOLOGY_A, 6, 6, true));
        rules.add(StationRule.duration(GYNECOLOGY_B, 6, 6, true));
        rules.add(StationRule.duration(MATERNITY_ER, 6, 6, true));
        rules.add(StationRule.duration(WOMENS_ER, 3, 3, false));
        rules.add(StationRule.duration(GYNECOLOGY_DAY, 3, 3, false));
        rules.add(StationRule.duration(MIDWIFERY_DAY, 3, 3, false));
        rules.add(StationRule.duration(BASIC_SCIENCES, 5, 0, false));
        rules.add(StationRule.duration(ROTATION_A, 3, 3, false));
        rules.add(StationRule.duration(STAGE_A, 1, 1, false));
        rules.add(StationRule.duration(ROTATION_B, 3, 3, false));
        rules.add(StationRule.duration(STAGE_B, 1, 1, false));
        rules.add(StationRule.duration(DEPARTMENT, 14, 14, false));
        rules.add(StationRule.duration(IVF, 3, 3, false));
        rules.add(StationRule.duration(GYNECO_ONCOLOGY, 2, 2, false));
        rules.add(StationRule.duration(ROTATION, 4, 3, false));
        rules.add(StationRule.duration(MATERNITY_ER_SUPERVISOR, 1, 1, false));

        rules.add(StationRule.capacity(floor, 2, HRP_A));
        rules.add(StationRule.capacity(floor, 2, HRP_B));
        rules.add(StationRule.capacity(staffingFloors ? 3 : 0, 4, BIRTH));
        rules.add(StationRule.capacity(floor, 2, GYNECOLOGY_A));
        rules.add(StationRule.capacity(floor, 2, GYNECOLOGY_B));
        rules.add(StationRule.capacity(staffingFloors ? 2 : 0, 4, MATERNITY_ER));
        rules.add(StationRule.capacity(floor, 3, WOMENS_ER));
        rules.add(StationRule.capacity(floor, 2, GYNECOLOGY_DAY));
        rules.add(StationRule.capacity(floor, 2, MIDWIFERY_DAY));
        rules.add(StationRule.capacity(staffingFloors ? 2 : 0, 4, IVF));
        rules.add(StationRule.capacity(0, 2, GYNECO_ONCOLOGY));
        rules.add(StationRule.capacity(0, 1, MATERNITY_ER_SUPERVISOR));

        rules.add(StationRule.sequence(BASIC_SCIENCES, STAGE_A, false));
        rules.add(StationRule.sequence(ROTATION_A, STAGE_A, true));
        rules.add(StationRule.sequence(ROTATION_B, STAGE_B, true));
        rules.add(StationRule.sequence(STAGE_A, STAGE_B, false));
        rules.add(StationRule.sequence(STAGE_A, MATERNITY_ER_SUPERVISOR, false));

        rules.add(StationRule.monthIndexWindow(STAGE_A, 36, 54, Month.JUNE));
        rules.add(StationRule.endRelativeWindow(STAGE_B, 1, 12, Month.NOVEMBER, Month.MARCH));
        return rules;
    }
}
