package org.dxworks.tagframe.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public class MarkupFileAnalysis implements Analysis {
    public String filePath;
    public String language;
    public int elementCount;
    public int maxDepth; // deepest element nesting, the outline itself stops nesting at 256
    public Map<String, Integer> shapes = new TreeMap<>(); // element count per shape, e.g. paired -> 12
    public Boolean roundTripVerified; // null when verification is disabled
    public List<DiagnosticInfo> diagnostics = new ArrayList<>();
    public List<ElementInfo> elements = new ArrayList<>();

    @Override
    public String getFilePath() {
        return filePath;
    }

    @Override
    public String getLanguage() {
        return language;
    }
}
