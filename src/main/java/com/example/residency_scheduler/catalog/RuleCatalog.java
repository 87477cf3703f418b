package com.example.residency_scheduler.catalog;

import com.example.residency_scheduler.exception.NoRuleSetForDateException;

import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Versioned store of syllabus rule sets. Versions are only ever inserted; a published version is
 * never replaced, so the rules applied to any past solve can be recovered by version id.
 */
@Slf4j
public class RuleCatalog {
    private final NavigableMap<LocalDate, SyllabusRuleSet> byEffectiveFrom = new TreeMap<>();
    private final Map<String, SyllabusRuleSet> byVersion = new ConcurrentHashMap<>();

    public RuleCatalog() {
    }

    public RuleCatalog(List<SyllabusRuleSet> initialVersions) {
        initialVersions.forEach(this::publish);
    }

    public static RuleCatalog withDefaultSyllabus() {
        return withDefaultSyllabus(false);
    }

    public static RuleCatalog withDefaultSyllabus(boolean staffingFloors) {
        return new RuleCatalog(List.of(DefaultSyllabus.ruleSet(staffingFloors)));
    }

    public synchronized void publish(SyllabusRuleSet ruleSet) {
        if (byVersion.containsKey(ruleSet.getVersion())) {
            throw new IllegalArgumentException("Rule set version already published: " + ruleSet.getVersion());
        }
        if (byEffectiveFrom.containsKey(ruleSet.getEffectiveFrom())) {
            throw new IllegalArgumentException(String.format("Version %s already takes effect on %s",
                byEffectiveFrom.get(ruleSet.getEffectiveFrom()).getVersion(), ruleSet.getEffectiveFrom()));
        }
        byEffectiveFrom.put(ruleSet.getEffectiveFrom(), ruleSet);
        byVersion.put(ruleSet.getVersion(), ruleSet);
        log.info("Published syllabus rule set {} ({} rules, effective {})",
            ruleSet.getVersion(), ruleSet.getRules().size(), ruleSet.getEffectiveFrom());
    }

    /**
     * The version with the latest effective date whose range contains the date. Where ranges
     * overlap the later start wins; a closed version that has lapsed uncovers the older one again.
     */
    public synchronized SyllabusRuleSet effectiveRuleSet(LocalDate date) {
        for (SyllabusRuleSet candidate : byEffectiveFrom.headMap(date, true).descendingMap().values()) {
            if (candidate.covers(date)) {
                return candidate;
            }
        }
        throw new NoRuleSetForDateException(date);
    }

    public SyllabusRuleSet byVersion(String version) {
        SyllabusRuleSet ruleSet = byVersion.get(version);
        if (ruleSet == null) {
            throw new NoRuleSetForDateException(version);
        }
        return ruleSet;
    }

    public synchronized List<SyllabusRuleSet> versions() {
        return new ArrayList<>(byEffectiveFrom.values());
    }
}
