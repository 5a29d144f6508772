package dev.vregress.testrunner;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;

public class AssertionDeclaration {

    @JacksonXmlProperty(isAttribute = true, localName = "kind")
    private String kind;

    @JacksonXmlProperty(isAttribute = true, localName = "file")
    private String file;

    @JacksonXmlProperty(isAttribute = true, localName = "golden")
    private String golden;

    @JacksonXmlProperty(isAttribute = true, localName = "pattern")
    private String pattern;

    @JacksonXmlProperty(isAttribute = true, localName = "group")
    private Integer group;

    @JacksonXmlProperty(isAttribute = true, localName = "expected")
    private String expected;

    public String getKind() {
        return kind;
    }

    public void setKind(String kind) {
        this.kind = kind;
    }

    public String getFile() {
        return file;
    }

    public void setFile(String file) {
        this.file = file;
    }

    public String getGolden() {
        return golden;
    }

    public void setGolden(String golden) {
        this.golden = golden;
    }

    public String getPattern() {
        return pattern;
    }

    public void setPattern(String pattern) {
        this.pattern = pattern;
    }

    public Integer getGroup() {
        return group;
    }

    public void setGroup(Integer group) {
        this.group = group;
    }

    public String getExpected() {
        return expected;
    }

    public void setExpected(String expected) {
        this.expected = expected;
    }

    @Override
    public String toString() {
        return "AssertionDeclaration{" +
                "kind='" + kind + '\'' +
                ", file='" + file + '\'' +
                ", golden='" + golden + '\'' +
                ", pattern='" + pattern + '\'' +
                ", group=" + group +
                ", expected='" + expected + '\'' +
                '}';
    }
}
