package com.example.nl2cmd.response;

import com.example.nl2cmd.model.DiagnosisResult;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DiagnosisResponse {
  String query;
  String os;
  List<DiagnosisResult> results;
  List<String> errors;
}
