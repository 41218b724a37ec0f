package org.carball.sift.cli;

import lombok.Data;
import org.carball.sift.config.OutputFormat;
import org.carball.sift.model.index.IngestionKind;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Data
public class SiftCliOptions {
    private String command;
    private List<Path> files = new ArrayList<>();
    private Path configFile;
    private String profile;
    private Path storeDir;
    private Path indexFile;
    private String outputFile;
    private OutputFormat outputFormat;
    private boolean verbose;

    // search filters
    private IngestionKind kind;
    private String category;
    private String text;
    private Integer limit;
}
