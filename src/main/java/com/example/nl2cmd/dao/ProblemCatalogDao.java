package com.example.nl2cmd.dao;

import com.example.nl2cmd.model.ProblemCategory;

import java.util.List;

public interface ProblemCatalogDao {

    /** Troubleshooting categories in catalog order. */
    List<ProblemCategory> findAll();
}
