package com.mcpbuilder.core.project;

import com.mcpbuilder.core.model.Permission;
import com.mcpbuilder.core.realtime.TopicAccessPolicy;
import org.springframework.stereotype.Component;

/**
 * Lets a user subscribe to progress of a stored project only if they can read it.
 * Project ids the store has never seen are allowed, since builds may be driven by an
 * external pipeline.
 */
@Component
public class ProjectAccessPolicy implements TopicAccessPolicy {

    private final ProjectStore projectStore;

    public ProjectAccessPolicy(ProjectStore projectStore) {
        this.projectStore = projectStore;
    }

    @Override
    public boolean canSubscribe(String userId, String topicId) {
        return projectStore.find(topicId)
                .map(project -> project.grants(userId, Permission.READ))
                .orElse(true);
    }
}
