package io.github.themoah.klimat.dataset;

import io.github.themoah.klimat.error.InputSchemaException;
import io.github.themoah.klimat.model.Observation;
import io.github.themoah.klimat.model.ObservationSnapshot;
import io.github.themoah.klimat.model.Season;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads historical temperature observations from a comma-separated file with a header row.
 *
 * <p>Required columns are {@code city}, {@code timestamp}, {@code temperature} and {@code season},
 * in any order; other columns are ignored. Fields may be double-quoted, with {@code ""} for a literal
 * quote, so a quoted field can hold commas and line breaks. Any schema violation rejects the whole input.
 */
public final class ObservationCsvLoader {

  private static final Logger log = LoggerFactory.getLogger(ObservationCsvLoader.class);

  static final String COLUMN_CITY = "city";
  static final String COLUMN_TIMESTAMP = "timestamp";
  static final String COLUMN_TEMPERATURE = "temperature";
  static final String COLUMN_SEASON = "season";

  private static final List<String> REQUIRED_COLUMNS =
    List.of(COLUMN_CITY, COLUMN_TIMESTAMP, COLUMN_TEMPERATURE, COLUMN_SEASON);

  private ObservationCsvLoader() {}

  /**
   * Loads observations from a UTF-8 CSV file.
   *
   * @param path the file to read
   * @return the observations in file order
   * @throws IOException if the file cannot be read
   * @throws InputSchemaException if a column is missing or a value is malformed
   */
  public static ObservationSnapshot load(Path path) throws IOException {
    log.info("Loading observations from file: {}", path);
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return load(reader);
    }
  }

  /**
   * Loads observations from CSV text.
   *
   * @param reader source of CSV text; not closed by this method
   * @return the observations in input order
   * @throws IOException if reading fails
   * @throws InputSchemaException if a column is missing or a value is malformed
   */
  public static ObservationSnapshot load(Reader reader) throws IOException {
    BufferedReader lines = reader instanceof BufferedReader buffered ? buffered : new BufferedReader(reader);

    String headerLine = lines.readLine();
    if (headerLine == null || headerLine.isBlank()) {
      throw new InputSchemaException("Missing header row", 1);
    }
    Header header = parseHeader(readRecord(lines, stripBom(headerLine), 1));

    int cityIdx = header.indexOf(COLUMN_CITY);
    int timestampIdx = header.indexOf(COLUMN_TIMESTAMP);
    int temperatureIdx = header.indexOf(COLUMN_TEMPERATURE);
    int seasonIdx = header.indexOf(COLUMN_SEASON);
    int width = header.width();

    List<Observation> observations = new ArrayList<>();
    long nextLine = 2;
    String line;
    while ((line = lines.readLine()) != null) {
      long lineNumber = nextLine;
      if (line.isBlank()) {
        nextLine++;
        continue;
      }
      Record record = readRecord(lines, line, lineNumber);
      nextLine = lineNumber + record.lineCount();
      List<String> fields = record.fields();
      if (fields.size() != width) {
        throw new InputSchemaException(
          "Expected " + width + " fields but found " + fields.size(), lineNumber);
      }
      observations.add(new Observation(
        requireText(fields.get(cityIdx), COLUMN_CITY, lineNumber),
        parseDate(fields.get(timestampIdx), lineNumber),
        parseSeason(fields.get(seasonIdx), lineNumber),
        parseTemperature(fields.get(temperatureIdx), lineNumber),
        Double.NaN
      ));
    }

    ObservationSnapshot snapshot = ObservationSnapshot.of(observations);
    log.info("Loaded {} observations for {} cities", snapshot.size(), snapshot.cities().size());
    return snapshot;
  }

  /**
   * Reads one record starting at {@code firstLine}, pulling further lines while a quoted field is open.
   */
  private static Record readRecord(BufferedReader lines, String firstLine, long lineNumber) throws IOException {
    StringBuilder text = new StringBuilder(firstLine);
    int lineCount = 1;
    List<String> fields;
    while ((fields = splitFields(text)) == null) {
      String continuation = lines.readLine();
      if (continuation == null) {
        throw new InputSchemaException("Unterminated quoted field", lineNumber);
      }
      text.append('\n').append(continuation);
      lineCount++;
    }
    return new Record(fields, lineCount);
  }

  /**
   * Splits a record on commas outside double quotes.
   *
   * @return the unquoted fields, or {@code null} if the text ends inside a quoted field
   */
  static List<String> splitFields(CharSequence text) {
    List<String> fields = new ArrayList<>();
    StringBuilder field = new StringBuilder();
    boolean quoted = false;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (quoted) {
        if (c == '"') {
          if (i + 1 < text.length() && text.charAt(i + 1) == '"') {
            field.append('"');
            i++;
          } else {
            quoted = false;
          }
        } else {
          field.append(c);
        }
      } else if (c == '"') {
        quoted = true;
      } else if (c == ',') {
        fields.add(field.toString());
        field.setLength(0);
      } else {
        field.append(c);
      }
    }
    if (quoted) {
      return null;
    }
    fields.add(field.toString());
    return fields;
  }

  private static Header parseHeader(Record record) {
    List<String> names = record.fields();
    Map<String, Integer> columns = new HashMap<>();
    for (int i = 0; i < names.size(); i++) {
      String name = names.get(i).trim().toLowerCase(Locale.ROOT);
      if (columns.putIfAbsent(name, i) != null && REQUIRED_COLUMNS.contains(name)) {
        throw new InputSchemaException("Duplicate column: " + name, 1);
      }
    }
    for (String required : REQUIRED_COLUMNS) {
      if (!columns.containsKey(required)) {
        throw new InputSchemaException("Missing required column: " + required, 1);
      }
    }
    return new Header(columns, names.size());
  }

  private static String requireText(String value, String column, long lineNumber) {
    String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      throw new InputSchemaException("Blank value in column " + column, lineNumber);
    }
    return trimmed;
  }

  private static LocalDate parseDate(String value, long lineNumber) {
    String text = requireText(value, COLUMN_TIMESTAMP, lineNumber);
    // Accept a time part and drop it
    if (text.length() > 10 && (text.charAt(10) == ' ' || text.charAt(10) == 'T')) {
      text = text.substring(0, 10);
    }
    try {
      return LocalDate.parse(text);
    } catch (DateTimeParseException e) {
      throw new InputSchemaException("Invalid timestamp: " + value, lineNumber, e);
    }
  }

  private static double parseTemperature(String value, long lineNumber) {
    String text = requireText(value, COLUMN_TEMPERATURE, lineNumber);
    try {
      double temperature = Double.parseDouble(text);
      if (Double.isNaN(temperature) || Double.isInfinite(temperature)) {
        throw new InputSchemaException("Temperature is not a finite number: " + value, lineNumber);
      }
      return temperature;
    } catch (NumberFormatException e) {
      throw new InputSchemaException("Invalid temperature: " + value, lineNumber, e);
    }
  }

  private static Season parseSeason(String value, long lineNumber) {
    String text = requireText(value, COLUMN_SEASON, lineNumber);
    try {
      return Season.fromLabel(text);
    } catch (IllegalArgumentException e) {
      throw new InputSchemaException("Invalid season: " + value, lineNumber, e);
    }
  }

  private static String stripBom(String line) {
    return !line.isEmpty() && line.charAt(0) == '\uFEFF' ? line.substring(1) : line;
  }

  private record Record(List<String> fields, int lineCount) {}

  /**
   * Column positions by lowercase name, and the number of fields every row must have.
   */
  private record Header(Map<String, Integer> columns, int width) {

    int indexOf(String column) {
      return columns.get(column);
    }
  }
}
