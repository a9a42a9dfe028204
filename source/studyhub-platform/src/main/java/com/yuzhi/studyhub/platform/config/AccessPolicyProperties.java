package com.yuzhi.studyhub.platform.config;

import com.yuzhi.studyhub.common.security.GrantMergePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "studyhub.platform.access")
public class AccessPolicyProperties {

    /**
     * How several grants for the same study in one token are combined. INDEPENDENT keeps one
     * OR clause per grant; MERGE_MOST_PERMISSIVE collapses them per study.
     */
    private GrantMergePolicy duplicateGrants = GrantMergePolicy.INDEPENDENT;

    /** Largest page a participant listing returns, whatever the request asks for. */
    private int maxPageSize = 500;

    public GrantMergePolicy getDuplicateGrants() {
        return duplicateGrants;
    }

    public void setDuplicateGrants(GrantMergePolicy duplicateGrants) {
        this.duplicateGrants = duplicateGrants;
    }

    public int getMaxPageSize() {
        return maxPageSize;
    }

    public void setMaxPageSize(int maxPageSize) {
        this.maxPageSize = maxPageSize;
    }
}
