package com.scholary.subtitle.editor.nlu;

/**
 * What the oracle made of a message.
 *
 * @param intent intent label such as {@code add_subtitle} or {@code help}
 * @param rawParameters parameter text as produced, normally a JSON object; may be null
 */
public record OracleReply(String intent, String rawParameters) {}
