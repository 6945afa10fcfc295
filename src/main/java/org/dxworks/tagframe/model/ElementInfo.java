package org.dxworks.tagframe.model;

import java.util.ArrayList;
import java.util.List;

public class ElementInfo {
    public String tag;
    public String shape; // paired, void, self_closing, malformed, unclosed, startless
    public List<ElementInfo> children = new ArrayList<>();

    public ElementInfo() {
    }

    public ElementInfo(String tag, String shape) {
        this.tag = tag;
        this.shape = shape;
    }
}
