package com.example.nl2cmd.dao;

import com.example.nl2cmd.model.CommandRule;
import com.example.nl2cmd.model.OsFamily;

import java.util.List;

public interface CommandRuleDao {

    /** Exact rules for one OS family, in priority order. */
    List<CommandRule> findByOs(OsFamily os);
}
