package dev.vregress.testrunner;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;

import java.util.List;

@JacksonXmlRootElement(localName = "RegressTest")
public class TestDeclaration {

    @JacksonXmlProperty(localName = "Scenarios")
    private String scenarios;

    @JacksonXmlProperty(localName = "TopFile")
    private String topFile;

    @JacksonXmlProperty(localName = "Golden")
    private String golden;

    @JacksonXmlProperty(localName = "TraceFormat")
    private String traceFormat;

    @JacksonXmlProperty(localName = "Skip")
    private String skip;

    @JacksonXmlProperty(localName = "Flags")
    private String flags;

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "FlagVariant")
    private List<String> flagVariants = List.of();

    @JacksonXmlProperty(localName = "Lint")
    private StageDeclaration lint;

    @JacksonXmlProperty(localName = "Compile")
    private StageDeclaration compile;

    @JacksonXmlProperty(localName = "Build")
    private StageDeclaration build;

    @JacksonXmlProperty(localName = "Execute")
    private StageDeclaration execute;

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "Assert")
    private List<AssertionDeclaration> assertions = List.of();

    public String getScenarios() {
        return scenarios;
    }

    public void setScenarios(String scenarios) {
        this.scenarios = scenarios;
    }

    public String getTopFile() {
        return topFile;
    }

    public void setTopFile(String topFile) {
        this.topFile = topFile;
    }

    public String getGolden() {
        return golden;
    }

    public void setGolden(String golden) {
        this.golden = golden;
    }

    public String getTraceFormat() {
        return traceFormat;
    }

    public void setTraceFormat(String traceFormat) {
        this.traceFormat = traceFormat;
    }

    public String getSkip() {
        return skip;
    }

    public void setSkip(String skip) {
        this.skip = skip;
    }

    public String getFlags() {
        return flags;
    }

    public void setFlags(String flags) {
        this.flags = flags;
    }

    public List<String> getFlagVariants() {
        return flagVariants;
    }

    public void setFlagVariants(List<String> flagVariants) {
        this.flagVariants = flagVariants;
    }

    public StageDeclaration getLint() {
        return lint;
    }

    public void setLint(StageDeclaration lint) {
        this.lint = lint;
    }

    public StageDeclaration getCompile() {
        return compile;
    }

    public void setCompile(StageDeclaration compile) {
        this.compile = compile;
    }

    public StageDeclaration getBuild() {
        return build;
    }

    public void setBuild(StageDeclaration build) {
        this.build = build;
    }

    public StageDeclaration getExecute() {
        return execute;
    }

    public void setExecute(StageDeclaration execute) {
        this.execute = execute;
    }

    public List<AssertionDeclaration> getAssertions() {
        return assertions;
    }

    public void setAssertions(List<AssertionDeclaration> assertions) {
        this.assertions = assertions;
    }

    @Override
    public String toString() {
        return "TestDeclaration{" +
                "scenarios='" + scenarios + '\'' +
                ", topFile='" + topFile + '\'' +
                ", flags='" + flags + '\'' +
                ", flagVariants=" + flagVariants +
                ", assertions=" + assertions +
                '}';
    }
}
