package ca.gc.cra.trail.domain.events;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Map;

/**
 * Payload recording an error encountered by an agent, with the fix that was attempted.
 *
 * @param agent agent that hit the error
 * @param errorType error category (often the exception class name)
 * @param errorMessage error message
 * @param severity severity; {@code null} when not reported
 * @param recoverable whether the workflow can continue
 * @param context where the error happened
 * @param stackTrace captured stack trace
 * @param attemptedFix fix that was attempted
 * @param fixSuccessful whether the fix resolved the error
 * @param recoveryTimeMs time to recover in milliseconds
 * @since 0.1.0
 */
public record ErrorReport(
    String agent,
    String errorType,
    String errorMessage,
    ErrorSeverity severity,
    Boolean recoverable,
    Map<String, Object> context,
    String stackTrace,
    String attemptedFix,
    Boolean fixSuccessful,
    Long recoveryTimeMs) implements EventPayload {

  public ErrorReport {
    context = PayloadFields.copyMap(context);
  }

  public static ErrorReport of(String agent, String errorType, String errorMessage) {
    return new ErrorReport(agent, errorType, errorMessage, null, null, null, null, null, null, null);
  }

  /**
   * Builds an error payload from a caught throwable, using its class name as the error type.
   *
   * @param agent agent that caught the failure
   * @param failure caught throwable
   * @return payload carrying type, message, and stack trace
   */
  public static ErrorReport fromThrowable(String agent, Throwable failure) {
    StringWriter trace = new StringWriter();
    failure.printStackTrace(new PrintWriter(trace));
    String message = failure.getMessage() == null ? failure.toString() : failure.getMessage();
    return new ErrorReport(
        agent, failure.getClass().getSimpleName(), message, null, null, null, trace.toString(), null, null, null);
  }

  public ErrorReport withSeverity(ErrorSeverity newSeverity, Boolean newRecoverable) {
    return new ErrorReport(
        agent, errorType, errorMessage, newSeverity, newRecoverable, context, stackTrace, attemptedFix,
        fixSuccessful, recoveryTimeMs);
  }

  public ErrorReport withContext(Map<String, Object> newContext) {
    return new ErrorReport(
        agent, errorType, errorMessage, severity, recoverable, newContext, stackTrace, attemptedFix,
        fixSuccessful, recoveryTimeMs);
  }

  public ErrorReport withFix(String fix, Boolean successful, Long recoveryMs) {
    return new ErrorReport(
        agent, errorType, errorMessage, severity, recoverable, context, stackTrace, fix, successful, recoveryMs);
  }

  @Override
  public EventType type() {
    return EventType.ERROR;
  }

  @Override
  public Map<String, Object> fields() {
    return new PayloadFields()
        .put("agent", agent)
        .put("error_type", errorType)
        .put("error_message", errorMessage)
        .put("severity", severity == null ? null : severity.wireName())
        .put("recoverable", recoverable)
        .put("context", context)
        .put("stack_trace", stackTrace)
        .put("attempted_fix", attemptedFix)
        .put("fix_successful", fixSuccessful)
        .put("recovery_time_ms", recoveryTimeMs)
        .build();
  }
}
