package optrace.core.export;

import static java.util.Objects.requireNonNull;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import javax.annotation.Nullable;
import optrace.core.ConsolidatedTrace;
import optrace.core.Profiler;
import optrace.core.ProfilerConfig;

/**
 * Profiles the enclosed block and writes its Chrome trace when closed.
 *
 * <pre>
 *   try (RecordProfile ignored = new RecordProfile(out)) {
 *     // profiled work
 *   }
 * </pre>
 */
public final class RecordProfile implements Closeable {
  private final OutputStream out;
  private final ChromeTraceExporter exporter;
  @Nullable private ConsolidatedTrace trace;
  private boolean closed;

  /** Starts a session configured from the process settings. */
  public RecordProfile(OutputStream out) {
    this(out, ProfilerConfig.fromSettings(), new ChromeTraceExporter());
  }

  public RecordProfile(OutputStream out, ProfilerConfig config, ChromeTraceExporter exporter) {
    this.out = requireNonNull(out, "Output stream cannot be null");
    this.exporter = requireNonNull(exporter, "Exporter cannot be null");
    Profiler.startSession(config);
  }

  /** Returns the trace of the block; {@code null} until closed. */
  @Nullable
  public ConsolidatedTrace trace() {
    return this.trace;
  }

  @Override
  public void close() throws IOException {
    if (this.closed) {
      return;
    }
    // a failed stop must not be retried against an outer session
    this.closed = true;
    this.trace = Profiler.stopSession();
    // device marker sessions leave their data to the vendor tools
    if (!this.trace.isEmpty()) {
      this.exporter.write(this.trace, this.out);
    }
  }
}
