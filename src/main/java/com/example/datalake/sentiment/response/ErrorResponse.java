package com.example.datalake.sentiment.response;

import java.util.List;

public record ErrorResponse(String error, List<String> details) {
}
