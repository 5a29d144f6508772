package dev.vregress.trace.saif;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import dev.vregress.trace.TraceParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

public final class SaifParser {

	private static final Logger log = LoggerFactory.getLogger(SaifParser.class);

	/**
	 * Header fields that describe the producing tool run rather than the recorded activity.
	 */
	public static final ImmutableSet<String> METADATA_FIELDS = ImmutableSet.of("DATE", "VENDOR", "PROGRAM_NAME", "VERSION");

	public static final String PATH_SEPARATOR = "/";

	private SaifParser(String content, String sourceName) {
		this.content = content;
		this.sourceName = sourceName;
	}

	private final String content;
	private final String sourceName;
	private int pos = 0;
	private int line = 1;

	private final TreeMap<String, String> header = new TreeMap<>();
	private final TreeSet<String> instances = new TreeSet<>();
	private final TreeMap<String, TreeMap<String, Long>> nets = new TreeMap<>();

	public static SaifDocument parse(Path file) throws IOException, TraceParseException {
		return parse(Files.readString(file, StandardCharsets.UTF_8), file.toString());
	}

	public static SaifDocument parse(String content, String sourceName) throws TraceParseException {
		var parser = new SaifParser(content, sourceName);
		var document = parser.parseDocument();
		log.debug("Parsed {}: {} instances, {} nets", sourceName, document.instances().size(), document.nets().size());
		return document;
	}

	private SaifDocument parseDocument() throws TraceParseException {
		var root = readNode();
		if(!(root instanceof SaifNode.Group group) || !group.keyword().equals("SAIFILE")) {
			throw new TraceParseException(sourceName, root.line(), "expected (SAIFILE ...) at top level");
		}

		skipWhitespace();
		if(pos < content.length()) {
			throw new TraceParseException(sourceName, line, "unexpected content after SAIFILE");
		}

		for(var item : group.items().subList(1, group.items().size())) {
			if(!(item instanceof SaifNode.Group child)) {
				throw new TraceParseException(sourceName, item.line(), "unexpected atom in SAIFILE: " + ((SaifNode.Atom)item).text());
			}

			var keyword = child.keyword();
			if(keyword.equals("INSTANCE")) {
				parseInstance(child, "");
			}
			else if(!METADATA_FIELDS.contains(keyword)) {
				header.put(keyword, headerValue(keyword, child));
			}
		}

		var netsBuilder = ImmutableSortedMap.<String, ImmutableSortedMap<String, Long>>naturalOrder();
		for(var entry : nets.entrySet()) {
			netsBuilder.put(entry.getKey(), ImmutableSortedMap.copyOfSorted(entry.getValue()));
		}

		return new SaifDocument(
			ImmutableSortedMap.copyOfSorted(header),
			ImmutableSortedSet.copyOfSorted(instances),
			netsBuilder.build()
		);
	}

	private String headerValue(String keyword, SaifNode.Group group) throws TraceParseException {
		var parts = new ArrayList<String>();
		for(var item : group.items().subList(1, group.items().size())) {
			if(!(item instanceof SaifNode.Atom atom)) {
				throw new TraceParseException(sourceName, item.line(), "unexpected group in header field " + keyword);
			}
			parts.add(atom.text());
		}

		// "1 ps" and "1ps" are the same timescale
		return keyword.equals("TIMESCALE") ? String.join("", parts) : String.join(" ", parts);
	}

	private void parseInstance(SaifNode.Group group, String parentPath) throws TraceParseException {
		var names = new ArrayList<String>();
		int index = 1;
		while(index < group.items().size() && group.items().get(index) instanceof SaifNode.Atom atom) {
			names.add(atom.text());
			++index;
		}

		if(names.isEmpty()) {
			throw new TraceParseException(sourceName, group.line(), "INSTANCE without a name");
		}

		// (INSTANCE [type] name ...)
		var name = names.get(names.size() - 1);
		var path = parentPath.isEmpty() ? name : parentPath + PATH_SEPARATOR + name;
		instances.add(path);

		for(var item : group.items().subList(index, group.items().size())) {
			if(!(item instanceof SaifNode.Group child)) {
				throw new TraceParseException(sourceName, item.line(), "unexpected atom in INSTANCE " + path);
			}

			switch(child.keyword()) {
				case "NET", "PORT" -> parseSignals(child, path);
				case "INSTANCE" -> parseInstance(child, path);
				default -> log.debug("{}:{}: ignoring ({} ...) in INSTANCE {}", sourceName, child.line(), child.keyword(), path);
			}
		}
	}

	private void parseSignals(SaifNode.Group group, String instancePath) throws TraceParseException {
		for(var item : group.items().subList(1, group.items().size())) {
			if(!(item instanceof SaifNode.Group signal) || signal.keyword().isEmpty()) {
				throw new TraceParseException(sourceName, item.line(), "expected (name (counter value) ...) in " + group.keyword());
			}

			var path = instancePath + PATH_SEPARATOR + signal.keyword();
			var counters = nets.computeIfAbsent(path, p -> new TreeMap<>());

			for(var counterItem : signal.items().subList(1, signal.items().size())) {
				if(!(counterItem instanceof SaifNode.Group counter) || counter.items().size() != 2
					|| !(counter.items().get(1) instanceof SaifNode.Atom value)) {
					throw new TraceParseException(sourceName, counterItem.line(), "expected (counter value) for " + path);
				}

				long count;
				try {
					count = Long.parseLong(value.text());
				}
				catch(NumberFormatException e) {
					throw new TraceParseException(sourceName, value.line(), "invalid counter value for " + path + " " + counter.keyword() + ": " + value.text());
				}

				// A net may appear as both PORT and NET; the listings have to agree
				var previous = counters.put(counter.keyword(), count);
				if(previous != null && previous != count) {
					throw new TraceParseException(sourceName, value.line(),
						"conflicting " + counter.keyword() + " for " + path + ": " + previous + " and " + count);
				}
			}
		}
	}

	private SaifNode readNode() throws TraceParseException {
		skipWhitespace();
		if(pos >= content.length()) {
			throw new TraceParseException(sourceName, line, "unexpected end of file");
		}

		char c = content.charAt(pos);
		if(c == ')') {
			throw new TraceParseException(sourceName, line, "unbalanced ')'");
		}

		if(c != '(') {
			return readAtom();
		}

		int startLine = line;
		++pos;

		List<SaifNode> items = new ArrayList<>();
		while(true) {
			skipWhitespace();
			if(pos >= content.length()) {
				throw new TraceParseException(sourceName, startLine, "unterminated '('");
			}

			if(content.charAt(pos) == ')') {
				++pos;
				return new SaifNode.Group(ImmutableList.copyOf(items), startLine);
			}

			items.add(readNode());
		}
	}

	private SaifNode.Atom readAtom() throws TraceParseException {
		int startLine = line;
		var text = new StringBuilder();

		if(content.charAt(pos) == '"') {
			++pos;
			while(pos < content.length() && content.charAt(pos) != '"') {
				if(content.charAt(pos) == '\n') {
					++line;
				}
				text.append(content.charAt(pos++));
			}
			if(pos >= content.length()) {
				throw new TraceParseException(sourceName, startLine, "unterminated string");
			}
			++pos;
			return new SaifNode.Atom(text.toString(), startLine);
		}

		while(pos < content.length()) {
			char c = content.charAt(pos);
			if(Character.isWhitespace(c) || c == '(' || c == ')') {
				break;
			}

			// Escaped characters in identifiers, e.g. data\[3\]
			if(c == '\\' && pos + 1 < content.length()) {
				text.append(content.charAt(pos + 1));
				pos += 2;
				continue;
			}

			text.append(c);
			++pos;
		}
		return new SaifNode.Atom(text.toString(), startLine);
	}

	private void skipWhitespace() {
		while(pos < content.length()) {
			char c = content.charAt(pos);
			if(c == '\n') {
				++line;
				++pos;
			}
			else if(Character.isWhitespace(c)) {
				++pos;
			}
			else if(c == '/' && pos + 1 < content.length() && content.charAt(pos + 1) == '/') {
				while(pos < content.length() && content.charAt(pos) != '\n') {
					++pos;
				}
			}
			else {
				return;
			}
		}
	}

	static String describeCounters(ImmutableSortedMap<String, Long> counters) {
		return counters.entrySet().stream()
			.map(e -> "(" + e.getKey() + " " + e.getValue() + ")")
			.collect(Collectors.joining(" "));
	}
}
