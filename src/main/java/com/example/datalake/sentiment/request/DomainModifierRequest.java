package com.example.datalake.sentiment.request;

import java.util.List;

public record DomainModifierRequest(List<Integer> bias, Integer intensity) {
}
