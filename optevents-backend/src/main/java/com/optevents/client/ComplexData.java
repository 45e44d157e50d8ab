package com.optevents.client;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A nested attribute bag: a list of {@code [key, value]} pairs in the order the service sent them.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ComplexData {
    private List<List<Object>> data = new ArrayList<>();
}
