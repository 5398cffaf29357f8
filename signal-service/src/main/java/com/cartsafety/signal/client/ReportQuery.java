package com.cartsafety.signal.client;

import java.time.LocalDate;

/**
 * One count query against the reporting database. A null term is unrestricted, so
 * {@code new ReportQuery(null, null, null)} counts every report in the database.
 *
 * @param asOf only reports received on or before this date are counted; null means all
 */
public record ReportQuery(String drugTerm, String eventTerm, LocalDate asOf) {

    public static ReportQuery cases(String drugTerm, String eventTerm, LocalDate asOf) {
        return new ReportQuery(drugTerm, eventTerm, asOf);
    }

    public static ReportQuery drugTotal(String drugTerm, LocalDate asOf) {
        return new ReportQuery(drugTerm, null, asOf);
    }

    public static ReportQuery eventTotal(String eventTerm, LocalDate asOf) {
        return new ReportQuery(null, eventTerm, asOf);
    }

    public static ReportQuery databaseTotal(LocalDate asOf) {
        return new ReportQuery(null, null, asOf);
    }

    public String cacheKey() {
        return (drugTerm == null ? "*" : drugTerm.toUpperCase())
            + "|" + (eventTerm == null ? "*" : eventTerm.toUpperCase())
            + "|" + (asOf == null ? "latest" : asOf.toString());
    }
}
