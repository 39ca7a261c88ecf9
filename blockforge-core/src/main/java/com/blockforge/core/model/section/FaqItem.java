package com.blockforge.core.model.section;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One question and answer pair.
 *
 * @param question question text
 * @param answer answer text or markup
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FaqItem(String question, String answer) {}
