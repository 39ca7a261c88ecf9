package com.blockforge.core.model.section;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;

/**
 * Configuration for a team section.
 *
 * @param title section heading
 * @param subtitle optional text below the heading
 * @param members members in display order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TeamConfig(
    String title,
    String subtitle,
    List<TeamMember> members
) {
    /**
     * Compact constructor normalizing the member list.
     */
    public TeamConfig {
        members = members == null ? List.of() : members.stream().filter(Objects::nonNull).toList();
    }
}
