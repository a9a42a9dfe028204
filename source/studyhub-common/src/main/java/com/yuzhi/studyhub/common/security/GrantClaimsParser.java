package com.yuzhi.studyhub.common.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yuzhi.studyhub.common.error.InvalidGrantException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns verified identity claims into a {@link Caller}.
 * <p>
 * Signature and expiry checks happen before this point; this class only checks the structure:
 * a caller id, a {@code studyAccess} list whose entries name a study and a known role, and a
 * sample list on every SAMPLE_ADMIN grant. The sample list may be an array or a JSON-encoded
 * array string.
 */
public class GrantClaimsParser {

    public static final String USER_ID_CLAIM = "userId";
    public static final String STUDY_ACCESS_CLAIM = "studyAccess";

    private static final Logger log = LoggerFactory.getLogger(GrantClaimsParser.class);
    private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final GrantMergePolicy mergePolicy;

    public GrantClaimsParser(ObjectMapper objectMapper, GrantMergePolicy mergePolicy) {
        this.objectMapper = objectMapper;
        this.mergePolicy = mergePolicy == null ? GrantMergePolicy.INDEPENDENT : mergePolicy;
    }

    public Caller parse(Map<String, Object> claims) {
        if (claims == null) {
            throw new InvalidGrantException("Invalid token claims");
        }
        String callerId = scalar(claims.get(USER_ID_CLAIM));
        if (StringUtils.isBlank(callerId)) {
            throw new InvalidGrantException("Invalid token claims: missing " + USER_ID_CLAIM);
        }
        Object rawAccess = claims.get(STUDY_ACCESS_CLAIM);
        if (!(rawAccess instanceof Collection<?> entries)) {
            throw new InvalidGrantException("Invalid token claims: missing " + STUDY_ACCESS_CLAIM);
        }
        List<StudyGrant> grants = new ArrayList<>(entries.size());
        int position = 0;
        for (Object entry : entries) {
            grants.add(parseGrant(entry, position++));
        }
        List<StudyGrant> effective = mergePolicy.apply(grants);
        if (log.isDebugEnabled()) {
            log.debug("Caller {} resolved with {} grant(s) ({} after {} policy)", callerId, grants.size(), effective.size(), mergePolicy);
        }
        return new Caller(callerId, effective);
    }

    private StudyGrant parseGrant(Object entry, int position) {
        if (!(entry instanceof Map<?, ?> access)) {
            throw new InvalidGrantException("Invalid study access claims at position " + position);
        }
        String studyId = scalar(access.get("studyId"));
        if (StringUtils.isBlank(studyId)) {
            throw new InvalidGrantException("Invalid study access claims at position " + position + ": missing studyId");
        }
        String roleName = scalar(access.get("role"));
        StudyRole role = StudyRole.fromClaim(roleName);
        if (role == null) {
            throw new InvalidGrantException("Invalid study access claims at position " + position + ": unknown role " + roleName);
        }
        if (role != StudyRole.SAMPLE_ADMIN) {
            return new StudyGrant(studyId, role, null);
        }
        Set<String> sampleIds = parseSampleIds(access.get("sampleIds"), position);
        return new StudyGrant(studyId, role, sampleIds);
    }

    private Set<String> parseSampleIds(Object raw, int position) {
        Object candidate = raw;
        if (candidate instanceof String text) {
            try {
                candidate = objectMapper.readValue(text, LIST_TYPE);
            } catch (JsonProcessingException ex) {
                throw new InvalidGrantException("Invalid study access claims at position " + position + ": sampleIds is not a list", ex);
            }
        }
        if (!(candidate instanceof Collection<?> values)) {
            throw new InvalidGrantException("Invalid study access claims at position " + position + ": SAMPLE_ADMIN requires sampleIds");
        }
        Set<String> sampleIds = new LinkedHashSet<>();
        for (Object value : values) {
            String sampleId = scalar(value);
            if (StringUtils.isNotBlank(sampleId)) {
                sampleIds.add(sampleId);
            }
        }
        return sampleIds;
    }

    private static String scalar(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof String text) {
            return text.trim();
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        return null;
    }
}
