package io.cronwarden.alert;

import io.cronwarden.core.Issue;
import io.cronwarden.core.WeeklyRollup;

import java.util.List;

/**
 * Delivers batched, non-urgent reports.
 */
public interface DigestNotifier {

    void deliverDigest(List<Issue> issues) throws Exception;

    void deliverWeeklySummary(WeeklyRollup rollup) throws Exception;
}
