package dev.vregress.trace.vcd;

import com.google.common.collect.ImmutableSortedMap;
import dev.vregress.trace.TraceParseException;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

public final class VcdParser {

	private static final Logger log = LoggerFactory.getLogger(VcdParser.class);

	private VcdParser(BufferedReader reader, String sourceName) {
		this.reader = reader;
		this.sourceName = sourceName;
	}

	private final BufferedReader reader;
	private final String sourceName;

	private String[] lineTokens = new String[0];
	private int tokenIndex = 0;
	private int lineNumber = 0;

	private String timescale = "";
	private final Deque<String> scopeStack = new ArrayDeque<>();
	private final TreeMap<String, String> scopes = new TreeMap<>();
	private final TreeMap<String, VcdSignal> signals = new TreeMap<>();
	private final Map<String, List<String>> pathsByCode = new HashMap<>();
	private final TreeMap<Long, TreeMap<String, String>> changes = new TreeMap<>();
	private long currentTime = 0;

	public static VcdTrace parse(Path file) throws IOException, TraceParseException {
		try(var reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			return parse(reader, file.toString());
		}
	}

	public static VcdTrace parse(String content, String sourceName) throws IOException, TraceParseException {
		return parse(new StringReader(content), sourceName);
	}

	public static VcdTrace parse(Reader reader, String sourceName) throws IOException, TraceParseException {
		var parser = new VcdParser(new BufferedReader(reader), sourceName);
		var trace = parser.parseTrace();
		log.debug("Parsed {}: {} signals, {} timestamps, {} changes",
			sourceName, trace.signals().size(), trace.changes().size(), trace.changeCount());
		return trace;
	}

	private VcdTrace parseTrace() throws IOException, TraceParseException {
		String token;
		while((token = nextToken()) != null) {
			if(token.startsWith("$")) {
				parseCommand(token);
			}
			else if(token.startsWith("#")) {
				currentTime = parseTime(token);
			}
			else {
				parseValueChange(token);
			}
		}

		if(!scopeStack.isEmpty()) {
			throw error("unterminated $scope " + scopePath());
		}

		var changesBuilder = ImmutableSortedMap.<Long, ImmutableSortedMap<String, String>>naturalOrder();
		for(var entry : changes.entrySet()) {
			changesBuilder.put(entry.getKey(), ImmutableSortedMap.copyOfSorted(entry.getValue()));
		}

		return new VcdTrace(
			timescale,
			ImmutableSortedMap.copyOfSorted(scopes),
			ImmutableSortedMap.copyOfSorted(signals),
			changesBuilder.build()
		);
	}

	private void parseCommand(String command) throws IOException, TraceParseException {
		switch(command) {
			case "$date", "$version", "$comment" -> readUntilEnd(command);

			case "$timescale" -> timescale = String.join("", readUntilEnd(command));

			case "$scope" -> {
				var body = readUntilEnd(command);
				if(body.size() != 2) {
					throw error("$scope expects a type and a name, got " + body);
				}
				scopeStack.addLast(body.get(1));
				scopes.put(scopePath(), body.get(0));
			}

			case "$upscope" -> {
				readUntilEnd(command);
				if(scopeStack.isEmpty()) {
					throw error("$upscope without matching $scope");
				}
				scopeStack.removeLast();
			}

			case "$var" -> parseVar(readUntilEnd(command));

			case "$enddefinitions" -> readUntilEnd(command);

			// Contents of these blocks are ordinary value changes at the current time
			case "$dumpvars", "$dumpall", "$dumpon", "$dumpoff", "$end" -> {}

			default -> readUntilEnd(command);
		}
	}

	private void parseVar(List<String> body) throws TraceParseException {
		if(body.size() < 4) {
			throw error("$var expects type, width, code and reference, got " + body);
		}

		var type = body.get(0);
		int width;
		try {
			width = Integer.parseInt(body.get(1));
		}
		catch(NumberFormatException e) {
			throw error("invalid $var width: " + body.get(1));
		}
		var code = body.get(2);
		var reference = String.join("", body.subList(3, body.size()));

		var scope = scopePath();
		var path = scope.isEmpty() ? reference : scope + "." + reference;

		signals.putIfAbsent(path, new VcdSignal(path, type, width));
		pathsByCode.computeIfAbsent(code, c -> new ArrayList<>()).add(path);
	}

	private void parseValueChange(String token) throws IOException, TraceParseException {
		char kind = token.charAt(0);
		String value;
		String code;
		switch(kind) {
			case 'b', 'B' -> {
				code = requireToken("identifier code after vector value " + token);
				var paths = declaredPaths(code);
				var atTime = changes.computeIfAbsent(currentTime, t -> new TreeMap<>());
				for(var path : paths) {
					atTime.put(path, normalizeVector(token.substring(1), signals.get(path).width()));
				}
				return;
			}
			case 'r', 'R', 's', 'S' -> {
				value = Character.toLowerCase(kind) + token.substring(1);
				code = requireToken("identifier code after value " + token);
			}
			default -> {
				if(!isScalarValue(kind) || token.length() < 2) {
					throw error("unrecognized token: " + token);
				}
				value = String.valueOf(Character.toLowerCase(kind));
				code = token.substring(1);
			}
		}

		var paths = declaredPaths(code);
		var atTime = changes.computeIfAbsent(currentTime, t -> new TreeMap<>());
		for(var path : paths) {
			atTime.put(path, value);
		}
	}

	private static boolean isScalarValue(char c) {
		return "01xXzZuUwWlLhH-".indexOf(c) >= 0;
	}

	private List<String> declaredPaths(String code) throws TraceParseException {
		var paths = pathsByCode.get(code);
		if(paths == null) {
			throw error("value change for undeclared identifier code " + code);
		}
		return paths;
	}

	/**
	 * Brings a vector value to the declared width. Short values are left-extended with {@code x} or
	 * {@code z} when that is the leftmost bit, otherwise with {@code 0}; redundant extension bits of a
	 * value wider than declared are dropped.
	 */
	static String normalizeVector(String bits, int width) {
		var value = bits.toLowerCase(Locale.ROOT);
		if(width <= 0 || value.isEmpty()) {
			return value;
		}

		if(value.length() < width) {
			return String.valueOf(extensionBit(value.charAt(0))).repeat(width - value.length()) + value;
		}

		int start = 0;
		while(value.length() - start > width && value.charAt(start) == extensionBit(value.charAt(start + 1))) {
			++start;
		}
		return value.substring(start);
	}

	private static char extensionBit(char leftmost) {
		return leftmost == 'x' || leftmost == 'z' ? leftmost : '0';
	}

	private long parseTime(String token) throws TraceParseException {
		try {
			long time = Long.parseLong(token.substring(1));
			if(time < currentTime) {
				throw error("time moves backwards: #" + currentTime + " to " + token);
			}
			return time;
		}
		catch(NumberFormatException e) {
			throw error("invalid timestamp: " + token);
		}
	}

	private String scopePath() {
		return String.join(".", scopeStack);
	}

	private List<String> readUntilEnd(String command) throws IOException, TraceParseException {
		var body = new ArrayList<String>();
		String token;
		while((token = nextToken()) != null) {
			if(token.equals("$end")) {
				return body;
			}
			body.add(token);
		}
		throw error(command + " is not terminated by $end");
	}

	private String requireToken(String what) throws IOException, TraceParseException {
		var token = nextToken();
		if(token == null) {
			throw error("unexpected end of file, expected " + what);
		}
		return token;
	}

	private @Nullable String nextToken() throws IOException {
		while(tokenIndex >= lineTokens.length) {
			var line = reader.readLine();
			if(line == null) {
				return null;
			}
			++lineNumber;
			var trimmed = line.trim();
			lineTokens = trimmed.isEmpty() ? new String[0] : trimmed.split("\\s+");
			tokenIndex = 0;
		}
		return lineTokens[tokenIndex++];
	}

	private TraceParseException error(String message) {
		return new TraceParseException(sourceName, lineNumber, message);
	}
}
