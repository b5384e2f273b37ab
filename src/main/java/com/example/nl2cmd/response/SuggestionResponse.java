package com.example.nl2cmd.response;

import com.example.nl2cmd.model.Suggestion;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SuggestionResponse {
  String query;
  String os;
  List<Suggestion> suggestions;
  List<String> errors;
}
