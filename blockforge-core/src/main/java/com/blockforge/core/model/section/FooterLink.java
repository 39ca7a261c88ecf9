package com.blockforge.core.model.section;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A link inside a footer column.
 *
 * @param text link label
 * @param url link target
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FooterLink(String text, String url) {}
