package com.di.migrationplanner.estimation.dto;

import com.di.migrationplanner.estimation.Calculator;
import lombok.Value;

import java.util.List;

/** Name, lookup id and required keys of a registered calculator. */
@Value
public class CalculatorInfo {
    String id;
    String name;
    List<String> keys;

    public static CalculatorInfo of(String id, Calculator calculator) {
        return new CalculatorInfo(id, calculator.name(), calculator.keys());
    }
}
