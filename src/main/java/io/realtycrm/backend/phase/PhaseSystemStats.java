package io.realtycrm.backend.phase;

/**
 * Tenant-wide snapshot of the phase system. Advisor counters only consider active, enrolled
 * memberships.
 */
public record PhaseSystemStats(
    long enrolledAdvisors,
    long phase1Advisors,
    long phase2Advisors,
    long phase3Advisors,
    long phase4Advisors,
    long phase5Advisors,
    long solitaryAdvisors,
    long totalPrestige,
    int maxUltra,
    long totalLeads,
    long assignedLeads,
    long pendingLeads) {}
