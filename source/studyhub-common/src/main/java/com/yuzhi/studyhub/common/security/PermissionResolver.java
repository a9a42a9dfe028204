package com.yuzhi.studyhub.common.security;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Derives the capability set of a caller from its grants through a fixed role table.
 */
public final class PermissionResolver {

    private static final Map<String, Set<String>> ROLE_PERMISSIONS = Map.of(
        StudyRole.STUDY_ADMIN.name(),
        Set.of(
            StudyPermissions.READ_USERS,
            StudyPermissions.READ_LOGS,
            StudyPermissions.READ_TASKS,
            StudyPermissions.READ_DATASETS,
            StudyPermissions.WRITE_USERS,
            StudyPermissions.WRITE_TASKS,
            StudyPermissions.ADMIN
        ),
        StudyRole.SAMPLE_ADMIN.name(),
        Set.of(
            StudyPermissions.READ_USERS,
            StudyPermissions.READ_LOGS,
            StudyPermissions.READ_TASKS,
            StudyPermissions.READ_DATASETS,
            StudyPermissions.WRITE_USERS
        ),
        StudyRole.VIEWER.name(),
        Set.of(StudyPermissions.READ_DATASETS)
    );

    private PermissionResolver() {}

    /**
     * Union of the role table entries of every grant. The result is unmodifiable.
     */
    public static Set<String> resolve(Collection<StudyGrant> grants) {
        if (grants == null || grants.isEmpty()) {
            return Set.of();
        }
        Set<String> permissions = new LinkedHashSet<>();
        for (StudyGrant grant : grants) {
            if (grant == null) continue;
            permissions.addAll(permissionsFor(grant.role().name()));
        }
        return Collections.unmodifiableSet(permissions);
    }

    /**
     * Permissions of a single role name. Unknown names contribute nothing; role names are
     * validated when claims are parsed, not here.
     */
    public static Set<String> permissionsFor(String roleName) {
        if (roleName == null) {
            return Set.of();
        }
        return ROLE_PERMISSIONS.getOrDefault(roleName, Set.of());
    }

    public static boolean hasPermission(Caller caller, String permission) {
        if (caller == null || permission == null) {
            return false;
        }
        return resolve(caller.grants()).contains(permission);
    }
}
