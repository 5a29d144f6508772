package dev.vregress.testrunner;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlText;

public class StageDeclaration {

    @JacksonXmlProperty(isAttribute = true, localName = "fails")
    private boolean fails;

    @JacksonXmlProperty(isAttribute = true, localName = "mode")
    private String mode;

    @JacksonXmlProperty(isAttribute = true, localName = "expect")
    private String expect;

    @JacksonXmlProperty(isAttribute = true, localName = "executable")
    private String executable;

    // Flags, or program arguments for <Execute>
    @JacksonXmlText
    private String flags;

    public boolean isFails() {
        return fails;
    }

    public void setFails(boolean fails) {
        this.fails = fails;
    }

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public String getExpect() {
        return expect;
    }

    public void setExpect(String expect) {
        this.expect = expect;
    }

    public String getExecutable() {
        return executable;
    }

    public void setExecutable(String executable) {
        this.executable = executable;
    }

    public String getFlags() {
        return flags;
    }

    public void setFlags(String flags) {
        this.flags = flags;
    }

    @Override
    public String toString() {
        return "StageDeclaration{" +
                "fails=" + fails +
                ", mode='" + mode + '\'' +
                ", expect='" + expect + '\'' +
                ", flags='" + flags + '\'' +
                '}';
    }
}
