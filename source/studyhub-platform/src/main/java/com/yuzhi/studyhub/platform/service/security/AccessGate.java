package com.yuzhi.studyhub.platform.service.security;

import com.yuzhi.studyhub.common.error.StudyForbiddenException;
import com.yuzhi.studyhub.common.security.Caller;
import com.yuzhi.studyhub.common.security.PermissionResolver;
import com.yuzhi.studyhub.common.security.StudyGrant;
import com.yuzhi.studyhub.common.security.StudyRole;
import com.yuzhi.studyhub.common.sql.PredicateContext;
import com.yuzhi.studyhub.common.sql.SqlPredicate;
import com.yuzhi.studyhub.common.sql.StudyPredicateCompiler;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class AccessGate {

    private static final Logger log = LoggerFactory.getLogger(AccessGate.class);

    public void authorize(Caller caller, String permission) {
        if (!PermissionResolver.hasPermission(caller, permission)) {
            if (log.isDebugEnabled()) {
                log.debug(
                    "Caller {} denied {}: resolved permissions={}",
                    caller == null ? null : caller.id(),
                    permission,
                    caller == null ? Set.of() : PermissionResolver.resolve(caller.grants())
                );
            }
            throw StudyForbiddenException.missingPermission(permission);
        }
    }

    /**
     * Passes when any grant the caller holds on {@code studyId} meets {@code minRole}.
     */
    public void authorizeStudy(Caller caller, String studyId, StudyRole minRole) {
        boolean allowed = caller != null && caller.grantsFor(studyId).stream().anyMatch(grant -> grant.role().isAtLeast(minRole));
        if (!allowed) {
            if (log.isDebugEnabled()) {
                log.debug("Caller {} denied study {} (minimum role {})", caller == null ? null : caller.id(), studyId, minRole);
            }
            throw StudyForbiddenException.studyNotAccessible(studyId);
        }
    }

    /**
     * Whether the caller may see a resource of {@code studyId} tied to {@code sampleId}. STUDY_ADMIN
     * sees every sample, SAMPLE_ADMIN its listed samples, VIEWER none. A {@code null} sample id is a
     * study-level resource and is visible with any grant on the study.
     */
    public boolean authorizeSample(Caller caller, String studyId, String sampleId) {
        if (caller == null) {
            return false;
        }
        List<StudyGrant> grants = caller.grantsFor(studyId);
        if (grants.isEmpty()) {
            return false;
        }
        if (sampleId == null) {
            return true;
        }
        boolean allowed = grants.stream().anyMatch(grant -> grant.coversSample(sampleId));
        if (!allowed && log.isDebugEnabled()) {
            log.debug("Caller {} denied sample {}/{}", caller.id(), studyId, sampleId);
        }
        return allowed;
    }

    /**
     * Study files are kept in one folder per role name. STUDY_ADMIN opens every folder of the
     * study; other grants open only the folder named after their own role.
     */
    public void authorizeRoleFolder(Caller caller, String studyId, String folder) {
        boolean allowed = caller != null &&
            caller.grantsFor(studyId).stream().anyMatch(grant -> grant.role() == StudyRole.STUDY_ADMIN || grant.role().name().equals(folder));
        if (!allowed) {
            if (log.isDebugEnabled()) {
                log.debug("Caller {} denied role folder {}/{}", caller == null ? null : caller.id(), studyId, folder);
            }
            throw StudyForbiddenException.roleFolderNotAccessible(studyId, folder);
        }
    }

    public Set<String> accessibleStudies(Caller caller, StudyRole minRole) {
        return caller == null ? Set.of() : caller.studyIds(minRole);
    }

    /**
     * Study/sample filter for the caller's grants, or empty when the caller holds none; an empty
     * result means the query would match nothing and should not be sent.
     */
    public Optional<SqlPredicate> scope(Caller caller, PredicateContext context, int firstParamIndex) {
        if (caller == null || !caller.hasGrants()) {
            return Optional.empty();
        }
        return Optional.of(StudyPredicateCompiler.compile(caller.grants(), context, firstParamIndex));
    }
}
