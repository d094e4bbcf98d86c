package ch.xavier.crossover.report;

import ch.xavier.crossover.backtesting.model.BacktestResult;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON form of a {@link BacktestResult}. Fields are mapped directly so that derived getters do
 * not leak into the document. An infinite profit factor is written as "Infinity".
 */
@Component
@Slf4j
public class BacktestReportSerializer {
    private final ObjectMapper mapper;

    public BacktestReportSerializer() {
        this.mapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .visibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE)
                .visibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY)
                .build();
    }

    public String toJson(BacktestResult result) {
        try {
            return mapper.writeValueAsString(result);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not serialize backtest report of " + result.getSymbol(), e);
        }
    }

    public BacktestResult fromJson(String json) {
        try {
            return mapper.readValue(json, BacktestResult.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read backtest report", e);
        }
    }

    public Path write(BacktestResult result, Path directory) {
        Path file = directory.resolve(result.getSymbol() + "_" + result.getStrategyName()
                .replaceAll("[^A-Za-z0-9]+", "_") + ".json");
        try {
            Files.createDirectories(directory);
            Files.writeString(file, toJson(result));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write backtest report to " + file, e);
        }
        log.info("Backtest report written to {}", file);
        return file;
    }

    public BacktestResult read(Path file) {
        try {
            return fromJson(Files.readString(file));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read backtest report " + file, e);
        }
    }
}
