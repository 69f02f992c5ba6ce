package com.consullo.rewritetree.builder;

import org.apache.commons.lang3.Validate;

/**
 * Display data for a rewritten term supplied by the rewriting engine.
 *
 * @param label the term's parse string, used as the node label
 * @param properties free-form description of the term (class, type, flags); may be empty
 * @since 1.0
 */
public record TermPayload(
    String label,
    String properties) {

  public TermPayload {
    Validate.notNull(label, "label must not be null.");
    properties = properties == null ? "" : properties;
  }

  public static TermPayload of(String label) {
    return new TermPayload(label, "");
  }
}
