package com.scholary.subtitle.editor.service;

import com.scholary.subtitle.editor.edit.EditParameters;

/**
 * First pipeline stage: the oracle's reading of a message.
 *
 * @param intent normalized intent label (trimmed, lower case)
 * @param parameters typed parameters extracted from the raw reply
 */
record InterpretedEdit(String intent, EditParameters parameters) {}
