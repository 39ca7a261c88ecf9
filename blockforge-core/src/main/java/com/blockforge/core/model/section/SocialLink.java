package com.blockforge.core.model.section;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A social network profile link.
 *
 * @param platform platform label (e.g. "Twitter")
 * @param url profile URL
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SocialLink(String platform, String url) {}
