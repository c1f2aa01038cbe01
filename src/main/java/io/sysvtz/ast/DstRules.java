package io.sysvtz.ast;

/**
 * The daylight-saving half of a timezone: its abbreviation, offset, and the yearly rules for
 * entering and leaving it.
 *
 * @param abbreviation the DST abbreviation
 * @param offsetSeconds the DST offset east of UT, in seconds
 * @param startRule when DST starts each year
 * @param endRule when DST ends each year
 */
public record DstRules(
    String abbreviation, int offsetSeconds, ChangeRule startRule, ChangeRule endRule) {}
