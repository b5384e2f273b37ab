package com.example.nl2cmd.risk;

import com.example.nl2cmd.model.RiskAssessment;

public interface RiskAssessor {

    RiskAssessment assessRisk(String command);
}
