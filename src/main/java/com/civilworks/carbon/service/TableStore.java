package com.civilworks.carbon.service;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.civilworks.carbon.config.AppProperties;
import com.civilworks.carbon.model.ContractRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * CSV tables with a header row, read and written through Jackson CSV.
 *
 * <p>Reads decode UTF-8 first (a leading BOM is dropped) and fall back to ISO-8859-1 when
 * the bytes are not valid UTF-8, which is what spreadsheet exports on Windows tend to produce.
 */
@Service
public class TableStore {
    private static final Logger log = LoggerFactory.getLogger(TableStore.class);

    private final CsvMapper csvMapper;
    private final AppProperties appProperties;

    public TableStore(CsvMapper csvMapper, AppProperties appProperties) {
        this.csvMapper = csvMapper;
        this.appProperties = appProperties;
    }

    /** Resolves a file name against the configured data directory. */
    public Path resolve(String fileName) {
        String dir = appProperties.getDataDir();
        if (dir == null || dir.isBlank()) dir = "data";
        return Path.of(dir).resolve(fileName);
    }

    public List<ContractRecord> readContracts(Path path) {
        List<ContractRecord> out = new ArrayList<>();
        for (Map<String, String> row : readRows(path)) {
            out.add(ContractRecord.fromRow(row));
        }
        return out;
    }

    public void writeContracts(Path path, List<ContractRecord> contracts) {
        List<Map<String, Object>> rows = new ArrayList<>(contracts.size());
        for (ContractRecord c : contracts) {
            rows.add(c.toRow());
        }
        writeRows(path, ContractRecord.COLUMNS, rows);
    }

    public List<Map<String, String>> readRows(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new MissingInputException(path.toString());
        }
        try {
            return parseRows(Files.readAllBytes(path), path.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }

    public List<Map<String, String>> parseRows(byte[] bytes, String sourceName) {
        String text = decode(bytes, sourceName);
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> it = csvMapper.readerForMapOf(String.class)
                .with(schema)
                .readValues(text)) {
            return it.readAll();
        } catch (IOException e) {
            throw new UncheckedIOException("Malformed CSV in " + sourceName, e);
        }
    }

    public void writeRows(Path path, List<String> columns, List<Map<String, Object>> rows) {
        CsvSchema.Builder builder = CsvSchema.builder();
        for (String c : columns) {
            builder.addColumn(c);
        }
        CsvSchema schema = builder.build().withHeader();
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
                 SequenceWriter seq = csvMapper.writer(schema)
                         .with(JsonGenerator.Feature.IGNORE_UNKNOWN)
                         .writeValues(writer)) {
                for (Map<String, Object> row : rows) {
                    seq.write(row);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + path, e);
        }
        log.info("Saved {} rows to {}", rows.size(), path);
    }

    static String decode(byte[] bytes, String sourceName) {
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            log.warn("UTF-8 failed for {}, trying Latin-1 encoding...", sourceName);
            text = new String(bytes, StandardCharsets.ISO_8859_1);
        }
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        return text;
    }
}
