package com.cube.orchestrator.domain.model;

import lombok.Value;

@Value
public class ModelFile {

    String fileName;
    String content;
}
