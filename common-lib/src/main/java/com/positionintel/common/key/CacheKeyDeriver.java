package com.positionintel.common.key;

import com.positionintel.common.model.MetricQuery;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDate;
import java.util.HexFormat;

/**
 * Turns a {@link MetricQuery} into a deterministic cache key.
 *
 * <p>Key layout: {@code <namespace>:subject=<s>:day=<asOf>:<sha256(canonical)>}, where the
 * namespace is {@link #POSITION_NAMESPACE} or {@link #TRENDS_NAMESPACE}. The readable prefix
 * lets callers invalidate whole families by substring ({@code "day=2024-01-01"},
 * {@code "subject=lgw-bcn:"}); the digest covers every canonical field, so queries that
 * differ in anything but context ordering or whitespace never share a key.
 *
 * <p>The subject in the prefix is URL-encoded. A subject containing {@code :} or {@code =}
 * therefore cannot reach into the prefix of another subject or imitate a day segment.
 *
 * <p>Stateless and thread-safe.
 */
public final class CacheKeyDeriver {

    public static final String POSITION_NAMESPACE = "competitive-position";
    public static final String TRENDS_NAMESPACE   = "competitive-trends";

    public String derive(MetricQuery query) {
        return derive(POSITION_NAMESPACE, query);
    }

    public String deriveTrends(MetricQuery query) {
        return derive(TRENDS_NAMESPACE, query);
    }

    /**
     * Substring matching every key derived for the subject in either namespace,
     * suitable for {@code invalidatePattern}.
     */
    public static String subjectPattern(String subjectId) {
        return "subject=" + encode(MetricQuery.normalize(subjectId)) + ":";
    }

    /** Substring matching every key whose as-of day is {@code asOf}. */
    public static String dayPattern(LocalDate asOf) {
        return ":day=" + asOf + ":";
    }

    private static String derive(String namespace, MetricQuery query) {
        return namespace
            + ":" + subjectPattern(query.subjectId())
            + "day=" + query.asOf()
            + ":" + sha256Hex(query.canonical());
    }

    private static String encode(String subject) {
        return URLEncoder.encode(subject, StandardCharsets.UTF_8);
    }

    static String sha256Hex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
