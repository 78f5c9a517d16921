package ca.gc.cra.cot.infrastructure.persistence;

import ca.gc.cra.cot.application.port.MetricsPort;
import ca.gc.cra.cot.application.port.ObservationStore;
import ca.gc.cra.cot.domain.report.Observation;
import ca.gc.cra.cot.domain.series.InstrumentSeries;
import ca.gc.cra.cot.domain.series.SeriesMerger;
import ca.gc.cra.cot.validation.Strings;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ObservationStore} keeping one CSV file per contract under a data directory.
 * <p><strong>Why:</strong> Plain CSV archives stay readable by spreadsheet and analysis tools while the merge rules
 * live in {@link SeriesMerger}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Store contract {@code CODE} in {@code <dataDir>/CODE_history.csv} with a header line, newest rows first.</li>
 *   <li>Replace archives through a synced temporary sibling and an atomic move so neither readers nor a crash
 *   leave a partial file.</li>
 *   <li>Serialize {@link #append} and {@link #save} within this instance.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use through one instance; separate processes writing the
 * same directory are not coordinated.</p>
 * <p><strong>Observability:</strong> Logs each save at INFO; observes {@code store.append.rows} and
 * {@code store.series.size}.</p>
 *
 * @since 0.1.0
 */
public final class CsvObservationStore implements ObservationStore {
  private static final Logger log = LoggerFactory.getLogger(CsvObservationStore.class);
  static final String FILE_SUFFIX = "_history.csv";
  private static final String TMP_SUFFIX = ".tmp";

  private final Path dataDir;
  private final MetricsPort metrics;
  private final ObjectWriter writer;
  private final ObjectReader reader;

  /**
   * Creates a store rooted at a data directory.
   *
   * @param dataDir directory holding archive files; created on first save
   */
  public CsvObservationStore(Path dataDir) {
    this(dataDir, MetricsPort.NO_OP);
  }

  /**
   * Creates a store rooted at a data directory.
   *
   * @param dataDir directory holding archive files; created on first save
   * @param metrics metrics sink; must not be {@code null}
   */
  public CsvObservationStore(Path dataDir, MetricsPort metrics) {
    this.dataDir = Objects.requireNonNull(dataDir, "dataDir").toAbsolutePath().normalize();
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    CsvMapper mapper = CsvMapper.builder()
        .enable(CsvParser.Feature.EMPTY_STRING_AS_NULL)
        .enable(CsvParser.Feature.TRIM_SPACES)
        .build();
    this.writer = mapper.writerFor(ObservationRow.class)
        .with(mapper.schemaFor(ObservationRow.class).withHeader())
        .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    this.reader = mapper.readerFor(ObservationRow.class)
        .with(CsvSchema.emptySchema().withHeader());
  }

  /**
   * Returns the archive file of a contract.
   *
   * @param contractCode contract code
   * @return path of the archive file, whether or not it exists
   * @throws IllegalArgumentException if the code is not a valid contract code
   */
  public Path fileFor(String contractCode) {
    return dataDir.resolve(Strings.sanitizeContractCode(contractCode) + FILE_SUFFIX);
  }

  /**
   * Returns the directory holding archive files.
   *
   * @return absolute data directory
   */
  public Path dataDir() {
    return dataDir;
  }

  @Override
  public Optional<InstrumentSeries> load(String contractCode) throws IOException {
    String code = Strings.sanitizeContractCode(contractCode);
    Path file = fileFor(code);
    if (!Files.isRegularFile(file)) {
      return Optional.empty();
    }
    List<Observation> observations = new ArrayList<>();
    try (BufferedReader in = Files.newBufferedReader(file, StandardCharsets.UTF_8);
        MappingIterator<ObservationRow> rows = reader.readValues(in)) {
      int line = 1;
      while (rows.hasNextValue()) {
        line++;
        ObservationRow row = rows.nextValue();
        try {
          observations.add(row.toObservation());
        } catch (IllegalArgumentException | DateTimeException ex) {
          throw new IOException("Malformed row " + line + " in " + file + ": " + ex.getMessage(), ex);
        }
      }
    }
    log.debug("Loaded {} rows from {}", observations.size(), file);
    return Optional.of(new InstrumentSeries(code, observations).descending());
  }

  @Override
  public synchronized void save(String contractCode, InstrumentSeries series) throws IOException {
    String code = Strings.sanitizeContractCode(contractCode);
    Objects.requireNonNull(series, "series");
    if (!code.equals(series.contractCode())) {
      throw new IllegalArgumentException(
          "series for contract " + series.contractCode() + " cannot be saved as " + code);
    }
    Files.createDirectories(dataDir);
    Path file = fileFor(code);
    Path tmp = file.resolveSibling(file.getFileName() + TMP_SUFFIX);
    List<ObservationRow> rows = series.descending().observations().stream().map(ObservationRow::from).toList();
    try (FileChannel channel = FileChannel.open(tmp,
            StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        BufferedWriter out = new BufferedWriter(
            new OutputStreamWriter(Channels.newOutputStream(channel), StandardCharsets.UTF_8))) {
      try (SequenceWriter sequence = writer.writeValues(out)) {
        sequence.writeAll(rows);
      }
      out.flush();
      // Rows must be on disk before the rename makes them the archive.
      channel.force(true);
    } catch (IOException ex) {
      Files.deleteIfExists(tmp);
      throw ex;
    }
    try {
      Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      log.debug("Atomic move unsupported in {}; replacing {} non-atomically", dataDir, file.getFileName());
      Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
    }
    forceDirectory();
    metrics.observe("store.series.size", rows.size());
    log.info("Saved {} rows to {}", rows.size(), file);
  }

  private void forceDirectory() {
    // Persists the rename itself; not every platform can open a directory for sync.
    try (FileChannel directory = FileChannel.open(dataDir, StandardOpenOption.READ)) {
      directory.force(true);
    } catch (IOException ex) {
      log.debug("Unable to sync directory {}: {}", dataDir, ex.getMessage());
    }
  }

  @Override
  public synchronized InstrumentSeries append(
      String contractCode, Collection<Observation> observations, boolean deduplicate) throws IOException {
    String code = Strings.sanitizeContractCode(contractCode);
    Objects.requireNonNull(observations, "observations");
    for (Observation observation : observations) {
      if (!code.equals(observation.contractCode())) {
        throw new IllegalArgumentException(
            "observation for contract '" + observation.contractCode() + "' cannot be appended to " + code);
      }
    }
    InstrumentSeries existing = load(code).orElseGet(() -> InstrumentSeries.empty(code));
    InstrumentSeries merged = SeriesMerger.merge(existing, observations, deduplicate);
    save(code, merged);
    metrics.observe("store.append.rows", observations.size());
    log.debug("Appended {} observations to {} ({} -> {} rows)",
        observations.size(), code, existing.size(), merged.size());
    return merged;
  }

  @Override
  public List<String> contracts() throws IOException {
    if (!Files.isDirectory(dataDir)) {
      return List.of();
    }
    List<String> codes = new ArrayList<>();
    try (DirectoryStream<Path> entries = Files.newDirectoryStream(dataDir, "*" + FILE_SUFFIX)) {
      for (Path entry : entries) {
        String name = entry.getFileName().toString();
        String code = name.substring(0, name.length() - FILE_SUFFIX.length());
        if (Files.isRegularFile(entry) && Strings.isValidContractCode(code)) {
          codes.add(code);
        }
      }
    }
    codes.sort(null);
    return List.copyOf(codes);
  }
}
