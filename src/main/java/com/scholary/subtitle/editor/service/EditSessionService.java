package com.scholary.subtitle.editor.service;

import com.scholary.subtitle.editor.edit.EditCompileException;
import com.scholary.subtitle.editor.edit.EditCompiler;
import com.scholary.subtitle.editor.edit.EditParameters;
import com.scholary.subtitle.editor.edit.ParameterExtractor;
import com.scholary.subtitle.editor.export.CueExporter;
import com.scholary.subtitle.editor.export.ExportCue;
import com.scholary.subtitle.editor.logging.StructuredLogger;
import com.scholary.subtitle.editor.nlu.NluOracle;
import com.scholary.subtitle.editor.nlu.OracleReply;
import com.scholary.subtitle.editor.nlu.TimelineContextDescriber;
import com.scholary.subtitle.editor.session.ChatMessage;
import com.scholary.subtitle.editor.session.EditSession;
import com.scholary.subtitle.editor.session.SessionNotFoundException;
import com.scholary.subtitle.editor.session.SessionStore;
import com.scholary.subtitle.editor.timeline.AppliedResult;
import com.scholary.subtitle.editor.timeline.Mutation;
import com.scholary.subtitle.editor.timeline.Subtitle;
import com.scholary.subtitle.editor.timeline.TimelineMutationException;
import com.scholary.subtitle.editor.timeline.TimelineStore;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs chat messages through the edit pipeline for one session.
 *
 * <p>Pipeline: look up the session, ask the oracle what the message means, extract typed
 * parameters, compile them into a mutation and apply it. Each stage hands an immutable record to
 * the next; any failure is thrown straight back to the caller and leaves the timeline as it was.
 * A completed request and its reply are appended to the session's chat history.
 *
 * <p>The oracle is called outside the timeline's lock, since it is slow and may time out. Only the
 * apply step takes the lock.
 */
@Service
public class EditSessionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(EditSessionService.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final SessionStore sessionStore;
  private final NluOracle oracle;
  private final ParameterExtractor parameterExtractor;
  private final EditCompiler editCompiler;
  private final TimelineContextDescriber contextDescriber;
  private final EditReplyWriter replyWriter;
  private final CueExporter cueExporter;

  public EditSessionService(
      SessionStore sessionStore,
      NluOracle oracle,
      ParameterExtractor parameterExtractor,
      EditCompiler editCompiler,
      TimelineContextDescriber contextDescriber,
      EditReplyWriter replyWriter,
      CueExporter cueExporter) {
    this.sessionStore = sessionStore;
    this.oracle = oracle;
    this.parameterExtractor = parameterExtractor;
    this.editCompiler = editCompiler;
    this.contextDescriber = contextDescriber;
    this.replyWriter = replyWriter;
    this.cueExporter = cueExporter;
  }

  /**
   * Start a new editing session with an empty timeline.
   *
   * @return the session id
   */
  public String createSession() {
    String sessionId = "sess_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    sessionStore.put(sessionId, new EditSession(new TimelineStore()));
    LOGGER.info("Created editing session: {}", sessionId);
    return sessionId;
  }

  /**
   * Process one chat message.
   *
   * @param sessionId the session to edit
   * @param message the user's message
   * @return the outcome, including the updated timeline
   * @throws SessionNotFoundException if the session does not exist
   * @throws EditCompileException if the extracted parameters cannot be used
   * @throws TimelineMutationException if the edit names no subtitle or breaks timing
   */
  public EditOutcome process(String sessionId, String message) {
    StructuredLogger.setSessionContext(sessionId);
    try {
      EditSession session = requireSession(sessionId);
      TimelineStore timeline = session.timeline();
      InterpretedEdit interpreted = interpret(message, timeline);
      CompiledEdit compiled = compile(interpreted, timeline);
      EditOutcome outcome = apply(sessionId, compiled, timeline);
      session.recordExchange(message, outcome.reply());
      return outcome;
    } finally {
      StructuredLogger.clearSessionContext();
    }
  }

  private InterpretedEdit interpret(String message, TimelineStore timeline) {
    String context = contextDescriber.describe(timeline.snapshot());
    OracleReply reply = oracle.interpret(message, context);

    String intent =
        reply.intent() == null ? "" : reply.intent().trim().toLowerCase(Locale.ROOT);
    LOGGER.debug("Oracle intent: '{}'", intent);

    try {
      EditParameters parameters = parameterExtractor.extract(reply.rawParameters());
      return new InterpretedEdit(intent, parameters);
    } catch (EditCompileException e) {
      STRUCTURED_LOGGER.logMutationRejected(intent, e.getClass().getSimpleName(), e.getMessage());
      throw e;
    }
  }

  private CompiledEdit compile(InterpretedEdit interpreted, TimelineStore timeline) {
    try {
      Optional<Mutation> mutation =
          editCompiler.compile(interpreted.intent(), interpreted.parameters(), timeline.snapshot());
      return new CompiledEdit(interpreted, mutation);
    } catch (EditCompileException e) {
      STRUCTURED_LOGGER.logMutationRejected(
          interpreted.intent(), e.getClass().getSimpleName(), e.getMessage());
      throw e;
    }
  }

  private EditOutcome apply(String sessionId, CompiledEdit compiled, TimelineStore timeline) {
    InterpretedEdit interpreted = compiled.interpreted();
    AppliedResult applied = null;

    if (compiled.mutation().isPresent()) {
      try {
        applied = timeline.apply(compiled.mutation().get());
      } catch (TimelineMutationException e) {
        STRUCTURED_LOGGER.logMutationRejected(
            interpreted.intent(), e.getClass().getSimpleName(), e.getMessage());
        throw e;
      }
      STRUCTURED_LOGGER.logMutationApplied(
          interpreted.intent(),
          applied.kind().name(),
          applied.subtitle().id(),
          applied.position(),
          applied.timelineSize());
    }

    String reply = replyWriter.write(interpreted.intent(), interpreted.parameters(), applied);
    return new EditOutcome(
        sessionId,
        interpreted.intent(),
        interpreted.parameters(),
        applied,
        reply,
        timeline.snapshot());
  }

  /** Current timeline of a session, in insertion order. */
  public List<Subtitle> subtitles(String sessionId) {
    return requireTimeline(sessionId).snapshot();
  }

  /** Chat history of a session, oldest first. */
  public List<ChatMessage> history(String sessionId) {
    return requireSession(sessionId).history();
  }

  /** Export cues for a session, in chronological order. */
  public List<ExportCue> exportCues(String sessionId) {
    return cueExporter.export(requireTimeline(sessionId).chronological());
  }

  /**
   * Remove every subtitle from a session.
   *
   * @return the number of subtitles removed
   */
  public int clearTimeline(String sessionId) {
    int removed = requireTimeline(sessionId).clear();
    LOGGER.info("Cleared {} subtitles from session {}", removed, sessionId);
    return removed;
  }

  public void closeSession(String sessionId) {
    sessionStore.remove(sessionId);
    LOGGER.info("Closed editing session: {}", sessionId);
  }

  private TimelineStore requireTimeline(String sessionId) {
    return requireSession(sessionId).timeline();
  }

  private EditSession requireSession(String sessionId) {
    return sessionStore.get(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
  }
}
