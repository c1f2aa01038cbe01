package io.sysvtz.ast;

/**
 * Sealed interface for the day part of a change rule.
 *
 * <p>There are 3 forms:
 *
 * <ul>
 *   <li>{@link JulianDay} - "J60", the nth day of a non-leap year; 29 February is never counted
 *   <li>{@link PlainDay} - "59", the zero-based day of the year; 29 February is counted
 *   <li>{@link MonthWeekDay} - "M3.2.0", a weekday in a week of a month
 * </ul>
 */
public sealed interface DayRule permits JulianDay, PlainDay, MonthWeekDay {}
