package optrace.core.export;

import static optrace.core.config.ProfilerSettings.PROFILER_TRACE_PID;
import static optrace.core.config.ProfilerSettings.PROFILER_TRACE_PID_DEFAULT;

import com.squareup.moshi.JsonWriter;
import java.io.IOException;
import java.io.OutputStream;
import javax.annotation.Nullable;
import okio.Buffer;
import okio.BufferedSink;
import optrace.core.ConsolidatedTrace;
import optrace.core.Event;
import optrace.core.EventKind;
import optrace.core.Profiler;
import optrace.core.ProfilerProtocolException;
import optrace.core.config.ConfigProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the ranges of a trace in the Chrome trace event format: a JSON array with one complete
 * event per range.
 *
 * <pre>
 *   [{"name":"add","ph":"X","ts":1.5,"dur":20.0,"tid":1,"pid":"CPU Functions","args":{}}]
 * </pre>
 *
 * <p>Timestamps are microseconds from the {@code __start_profile} mark. The whole output is
 * rendered before anything is written, so a failing export writes nothing.
 */
public final class ChromeTraceExporter {
  private static final Logger log = LoggerFactory.getLogger(ChromeTraceExporter.class);

  private final String pid;

  /** Creates an exporter labelling events with the configured process name. */
  public ChromeTraceExporter() {
    this(ConfigProvider.get().getString(PROFILER_TRACE_PID, PROFILER_TRACE_PID_DEFAULT));
  }

  public ChromeTraceExporter(String pid) {
    this.pid = pid;
  }

  /**
   * Renders the trace.
   *
   * @throws ProfilerProtocolException if the trace has no {@code __start_profile} mark.
   */
  public String toJson(ConsolidatedTrace trace) {
    return render(trace).readUtf8();
  }

  public void write(ConsolidatedTrace trace, OutputStream out) throws IOException {
    render(trace).writeTo(out);
    out.flush();
  }

  public void write(ConsolidatedTrace trace, BufferedSink sink) throws IOException {
    sink.writeAll(render(trace));
    sink.flush();
  }

  private Buffer render(ConsolidatedTrace trace) {
    Event startMark = startMark(trace);
    if (startMark == null) {
      throw new ProfilerProtocolException(
          "Can't export a trace without a " + Profiler.START_MARK + " mark");
    }
    RangeTree tree = RangeTree.build(trace);
    Buffer buffer = new Buffer();
    try (JsonWriter writer = JsonWriter.of(buffer)) {
      writer.beginArray();
      int count = 0;
      for (RangeNode range : tree.ranges()) {
        writer.beginObject();
        writer.name("name").value(range.name());
        writer.name("ph").value("X");
        writer.name("ts").value(startMark.cpuElapsedUs(range.start()));
        writer.name("dur").value(range.cpuElapsedUs());
        writer.name("tid").value(range.threadId());
        writer.name("pid").value(this.pid);
        writer.name("args").beginObject().endObject();
        writer.endObject();
        count++;
      }
      writer.endArray();
      log.debug("Exported {} ranges", count);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to render the trace", e);
    }
    return buffer;
  }

  @Nullable
  private static Event startMark(ConsolidatedTrace trace) {
    for (Event event : trace.allEvents()) {
      if (event.kind() == EventKind.MARK && Profiler.START_MARK.equals(event.name())) {
        return event;
      }
    }
    return null;
  }
}
