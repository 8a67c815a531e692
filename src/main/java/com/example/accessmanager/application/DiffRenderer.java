package com.example.accessmanager.application;

import com.example.accessmanager.domain.DiffResult;
import com.example.accessmanager.domain.Diffable;

import java.util.List;

public interface DiffRenderer {
    <T extends Diffable<T, ?>> List<String> render(DiffResult<T> diff, DiffHeaders headers);

    /**
     * Line diff of two renderings that never abbreviates runs of equal lines.
     */
    List<String> renderLineDiff(String actual, String target);

    List<String> renderNames(String header, List<String> names);
}
