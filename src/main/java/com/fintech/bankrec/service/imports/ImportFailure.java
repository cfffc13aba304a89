package com.fintech.bankrec.service.imports;

import lombok.Value;

@Value
public class ImportFailure {
    int rowIndex;
    String message;
}
