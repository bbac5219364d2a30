package io.laminar.cli.io;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.laminar.cli.exception.SheetReadException;
import io.laminar.core.document.ProcessDocument;
import io.laminar.core.exception.InvalidProcessDocumentException;
import io.laminar.core.extraction.ExtractionMode;
import io.laminar.core.pipeline.SheetTask;
import io.laminar.core.template.SheetTable;
import io.laminar.serialization.ProcessSerializer;
import jakarta.enterprise.context.ApplicationScoped;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

/// Reads the command input into sheets or a canonical document.
///
/// ### Supported Inputs
/// | Extension | Reader | Sheets |
/// |-----------|--------|--------|
/// | `.xlsx`, `.xlsm`, `.xls` | Apache POI | every sheet, or the one named by `--sheet` |
/// | `.csv` | Jackson CSV, `,` `;` or tab separated | one, named after the file |
/// | `.json` | canonical process document | one, named after the file |
///
/// The first row of a sheet is its header row. Every later row up to the last used row
/// is kept, blank rows included, so row numbers in findings match the spreadsheet.
/// Cells are read as the text a spreadsheet would display; formulas are evaluated.
///
/// @implNote Stateless and thread-safe.
@ApplicationScoped
public class WorkbookReader {

    private static final Logger logger = Logger.getLogger(WorkbookReader.class.getName());

    private static final List<String> WORKBOOK_EXTENSIONS = List.of("xlsx", "xlsm", "xls");

    private static final CsvMapper CSV_MAPPER =
            CsvMapper.builder().enable(CsvParser.Feature.WRAP_AS_ARRAY).build();

    /// Returns whether the file holds a canonical document rather than a sheet.
    public boolean isDocument(Path file) {
        return "json".equals(extension(file));
    }

    /// Reads the input as batch tasks.
    ///
    /// @param file input file, not null
    /// @param sheetName only this sheet of a workbook, null for every sheet
    /// @param mode extraction mode for sheet tasks, not null
    /// @return one task per sheet in workbook order, never null
    /// @throws SheetReadException if the file cannot be read or the sheet does not exist
    public List<SheetTask> readTasks(Path file, String sheetName, ExtractionMode mode)
            throws SheetReadException {
        if (isDocument(file)) {
            return List.of(SheetTask.of(sheetNameOf(file), readDocument(file)));
        }
        List<SheetTask> tasks = new ArrayList<>();
        for (SheetTable sheet : readSheets(file, sheetName)) {
            tasks.add(SheetTask.of(sheet, mode));
        }
        return tasks;
    }

    /// Reads the sheets of a workbook or CSV file.
    ///
    /// @param file input file, not null
    /// @param sheetName only this sheet of a workbook, null for every sheet
    /// @return sheets in workbook order, never null
    /// @throws SheetReadException if the file cannot be read or the sheet does not exist
    public List<SheetTable> readSheets(Path file, String sheetName) throws SheetReadException {
        requireReadable(file);
        String extension = extension(file);
        if (WORKBOOK_EXTENSIONS.contains(extension)) {
            return readWorkbook(file, sheetName);
        }
        if ("csv".equals(extension)) {
            if (sheetName != null) {
                logger.fine("Ignoring sheet name '" + sheetName + "' for CSV input " + file);
            }
            return List.of(readCsv(file));
        }
        throw new SheetReadException(
                "Unsupported input type: "
                        + file.getFileName()
                        + ". Expected .xlsx, .xlsm, .xls, .csv or .json");
    }

    /// Reads a canonical process document.
    ///
    /// @param file JSON file, not null
    /// @return parsed document, never null
    /// @throws SheetReadException if the file cannot be read or parsed
    public ProcessDocument readDocument(Path file) throws SheetReadException {
        requireReadable(file);
        try {
            return ProcessSerializer.fromJson(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new SheetReadException("Failed to read " + file + ": " + e.getMessage(), e);
        } catch (InvalidProcessDocumentException e) {
            throw new SheetReadException(file.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private List<SheetTable> readWorkbook(Path file, String sheetName) throws SheetReadException {
        try (Workbook workbook = WorkbookFactory.create(file.toFile(), null, true)) {
            DataFormatter formatter = new DataFormatter(Locale.ROOT);
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();

            List<SheetTable> sheets = new ArrayList<>();
            List<String> available = new ArrayList<>();
            for (Sheet sheet : workbook) {
                available.add(sheet.getSheetName());
                if (sheetName != null && !sheetName.equals(sheet.getSheetName())) {
                    continue;
                }
                if (sheet.getPhysicalNumberOfRows() == 0) {
                    logger.info("Skipping empty sheet '" + sheet.getSheetName() + "'");
                    continue;
                }
                sheets.add(toTable(sheet, formatter, evaluator));
            }

            if (sheetName != null && !available.contains(sheetName)) {
                throw new SheetReadException(
                        "Sheet '"
                                + sheetName
                                + "' not found in "
                                + file.getFileName()
                                + ". Available: "
                                + String.join(", ", available));
            }
            logger.info("Read " + sheets.size() + " sheet(s) from " + file.getFileName());
            return sheets;
        } catch (IOException | EncryptedDocumentException | UnsupportedFileFormatException e) {
            throw new SheetReadException(
                    "Failed to open workbook " + file + ": " + e.getMessage(), e);
        }
    }

    private SheetTable toTable(Sheet sheet, DataFormatter formatter, FormulaEvaluator evaluator) {
        int headerIndex = sheet.getFirstRowNum();
        List<String> headers = readRow(sheet.getRow(headerIndex), 0, formatter, evaluator);

        List<List<String>> rows = new ArrayList<>();
        for (int r = headerIndex + 1; r <= sheet.getLastRowNum(); r++) {
            rows.add(readRow(sheet.getRow(r), headers.size(), formatter, evaluator));
        }
        return new SheetTable(sheet.getSheetName(), headers, rows);
    }

    private List<String> readRow(
            Row row, int minWidth, DataFormatter formatter, FormulaEvaluator evaluator) {
        List<String> cells = new ArrayList<>();
        int width = row != null ? Math.max(minWidth, row.getLastCellNum()) : minWidth;
        for (int c = 0; c < width; c++) {
            Cell cell = row != null ? row.getCell(c) : null;
            cells.add(cellText(cell, formatter, evaluator));
        }
        return cells;
    }

    private String cellText(Cell cell, DataFormatter formatter, FormulaEvaluator evaluator) {
        if (cell == null) {
            return "";
        }
        try {
            return formatter.formatCellValue(cell, evaluator);
        } catch (RuntimeException e) {
            logger.warning(
                    "Cannot evaluate cell "
                            + cell.getAddress()
                            + " of sheet '"
                            + cell.getSheet().getSheetName()
                            + "', using its formula text: "
                            + e.getMessage());
            return formatter.formatCellValue(cell);
        }
    }

    private SheetTable readCsv(Path file) throws SheetReadException {
        try {
            CsvSchema schema = CsvSchema.emptySchema().withColumnSeparator(detectSeparator(file));
            List<List<String>> records;
            try (MappingIterator<List<String>> iterator =
                    CSV_MAPPER
                            .readerForListOf(String.class)
                            .with(schema)
                            .readValues(file.toFile())) {
                records = iterator.readAll();
            }
            if (records.isEmpty()) {
                throw new SheetReadException("CSV file " + file.getFileName() + " is empty");
            }
            return new SheetTable(
                    sheetNameOf(file), records.get(0), records.subList(1, records.size()));
        } catch (IOException e) {
            throw new SheetReadException("Failed to read CSV " + file + ": " + e.getMessage(), e);
        }
    }

    /// Picks the most frequent of `,` `;` and tab in the header line.
    static char detectSeparator(Path file) throws IOException {
        String header;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            header = reader.readLine();
        }
        if (header == null) {
            return ',';
        }
        char best = ',';
        long bestCount = header.chars().filter(ch -> ch == ',').count();
        for (char candidate : new char[] {';', '\t'}) {
            long count = header.chars().filter(ch -> ch == candidate).count();
            if (count > bestCount) {
                best = candidate;
                bestCount = count;
            }
        }
        return best;
    }

    private static void requireReadable(Path file) throws SheetReadException {
        if (!Files.isRegularFile(file)) {
            throw new SheetReadException("Input file not found: " + file);
        }
        if (!Files.isReadable(file)) {
            throw new SheetReadException("Input file is not readable: " + file);
        }
    }

    /// Returns the sheet name used for CSV and JSON inputs: the file name without extension.
    public static String sheetNameOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String extension(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }
}
