package com.example.retrain.store;

import com.example.retrain.ml.TrainingRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * The original training dataset, read once from CSV.
 * <p>
 * Expected header: the eight {@link FeatureDomain} columns followed by {@code target}.
 * A missing resource yields an empty dataset; a malformed row is an error.
 */
@Slf4j
public class SeedDataset {

    private final List<TrainingRow> rows;

    public SeedDataset(List<TrainingRow> rows) {
        this.rows = List.copyOf(rows);
    }

    public static SeedDataset load(Resource csv) {
        if (csv == null || !csv.exists()) {
            log.info("No seed dataset at {}; history starts empty.", csv);
            return new SeedDataset(List.of());
        }
        List<TrainingRow> out = new ArrayList<>();
        try (BufferedReader br = new BufferedReader(new InputStreamReader(csv.getInputStream(), StandardCharsets.UTF_8))) {
            String header = br.readLine();
            String[] cols = FeatureDomain.columns();
            String expected = String.join(",", cols) + ",target";
            if (header == null || !header.trim().equals(expected)) {
                throw new IllegalStateException("Unexpected seed header in " + csv + ": " + header);
            }
            String line;
            int n = 1;
            while ((line = br.readLine()) != null) {
                n++;
                if (line.isBlank()) continue;
                String[] parts = line.split(",", -1);
                if (parts.length != cols.length + 1) {
                    throw new IllegalStateException("Bad seed row " + n + " in " + csv + ": " + line);
                }
                double[] x = new double[cols.length];
                for (int i = 0; i < cols.length; i++) x[i] = Double.parseDouble(parts[i].trim());
                out.add(new TrainingRow(x, Double.parseDouble(parts[cols.length].trim())));
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        log.info("Loaded seed dataset: rows={} from {}", out.size(), csv);
        return new SeedDataset(out);
    }

    public List<TrainingRow> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }
}
