package org.dxworks.tagframe.model;

public class DiagnosticInfo {
    public String code;
    public String message;
    public int offset;

    public DiagnosticInfo() {
    }

    public DiagnosticInfo(String code, String message, int offset) {
        this.code = code;
        this.message = message;
        this.offset = offset;
    }
}
