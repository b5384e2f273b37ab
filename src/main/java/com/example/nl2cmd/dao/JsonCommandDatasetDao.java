package com.example.nl2cmd.dao;

import com.example.nl2cmd.config.Nl2CmdProperties;
import com.example.nl2cmd.model.CommandRecord;
import com.example.nl2cmd.model.OsFamily;
import com.example.nl2cmd.util.JsonResources;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Curated dataset read once at startup. Records listed under {@code git} apply to every OS family.
 * A missing or unreadable dataset leaves the DAO empty.
 */
@Slf4j
@Repository
public class JsonCommandDatasetDao implements CommandDatasetDao {

    private final Map<OsFamily, List<CommandRecord>> recordsByOs;

    @Autowired
    public JsonCommandDatasetDao(ResourceLoader resourceLoader, Nl2CmdProperties properties) {
        this(load(resourceLoader, properties.getDataset().getCommands()));
    }

    private JsonCommandDatasetDao(Map<OsFamily, List<CommandRecord>> recordsByOs) {
        Map<OsFamily, List<CommandRecord>> copy = new EnumMap<>(OsFamily.class);
        recordsByOs.forEach((os, records) -> copy.put(os, List.copyOf(records)));
        this.recordsByOs = Collections.unmodifiableMap(copy);
    }

    public static JsonCommandDatasetDao of(Map<OsFamily, List<CommandRecord>> recordsByOs) {
        return new JsonCommandDatasetDao(recordsByOs);
    }

    @Override
    public List<CommandRecord> findByOs(OsFamily os) {
        return recordsByOs.getOrDefault(os, List.of());
    }

    private static Map<OsFamily, List<CommandRecord>> load(ResourceLoader loader, String location) {
        Map<OsFamily, List<CommandRecord>> out = new EnumMap<>(OsFamily.class);
        Optional<DatasetBundle> bundle;
        try {
            bundle = JsonResources.read(loader, location, DatasetBundle.class);
        } catch (IOException ex) {
            log.warn("Failed to load command dataset from {}: {}", location, ex.getMessage());
            return out;
        }
        if (bundle.isEmpty()) {
            log.warn("Command dataset {} not found; approximate matching will be disabled", location);
            return out;
        }

        DatasetBundle data = bundle.get();
        out.put(OsFamily.WINDOWS, merge(data.windows, data.git));
        out.put(OsFamily.LINUX, merge(data.linux, data.git));
        log.info("Loaded command dataset from {}: windows={}, linux={}",
                location, out.get(OsFamily.WINDOWS).size(), out.get(OsFamily.LINUX).size());
        return out;
    }

    private static List<CommandRecord> merge(List<CommandRecord> osRecords, List<CommandRecord> shared) {
        List<CommandRecord> merged = new ArrayList<>();
        for (List<CommandRecord> source : List.of(nullToEmpty(osRecords), nullToEmpty(shared))) {
            for (CommandRecord record : source) {
                if (record != null && record.isComplete()) {
                    merged.add(record);
                }
            }
        }
        return merged;
    }

    private static List<CommandRecord> nullToEmpty(List<CommandRecord> list) {
        return list == null ? List.of() : list;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class DatasetBundle {
        public List<CommandRecord> windows;
        public List<CommandRecord> linux;
        public List<CommandRecord> git;
    }
}
