package com.example.nl2cmd.dao;

import com.example.nl2cmd.model.CommandRecord;
import com.example.nl2cmd.model.OsFamily;

import java.util.List;

public interface CommandDatasetDao {

    /**
     * Curated query/command records for one OS family, including the cross-platform records, in
     * dataset order.
     */
    List<CommandRecord> findByOs(OsFamily os);
}
