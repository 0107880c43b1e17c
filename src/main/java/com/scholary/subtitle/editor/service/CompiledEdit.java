package com.scholary.subtitle.editor.service;

import com.scholary.subtitle.editor.timeline.Mutation;
import java.util.Optional;

/** Second pipeline stage: the mutation to apply, if the intent edits anything. */
record CompiledEdit(InterpretedEdit interpreted, Optional<Mutation> mutation) {}
