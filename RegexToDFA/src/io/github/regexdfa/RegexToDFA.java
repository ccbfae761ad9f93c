// RegexToDFA - Convert regular expressions to deterministic finite automata
// Copyright (C) 2013,2017,2026 David H. Hovemeyer <david.hovemeyer@gmail.com>
//
// Permission is hereby granted, free of charge, to any person obtaining
// a copy of this software and associated documentation files (the
// "Software"), to deal in the Software without restriction, including
// without limitation the rights to use, copy, modify, merge, publish,
// distribute, sublicense, and/or sell copies of the Software, and to
// permit persons to whom the Software is furnished to do so, subject to
// the following conditions:
// 
// The above copyright notice and this permission notice shall be included
// in all copies or substantial portions of the Software.
// 
// THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
// EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF
// MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT.
// IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY
// CLAIM, DAMAGES OR OTHER LIABILITY, WHETHER IN AN ACTION OF CONTRACT,
// TORT OR OTHERWISE, ARISING FROM, OUT OF OR IN CONNECTION WITH THE
// SOFTWARE OR THE USE OR OTHER DEALINGS IN THE SOFTWARE.

package io.github.regexdfa;

import java.io.File;
import java.io.FileReader;
import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Scanner;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line tool converting regular expressions to DFAs.
 * The DFA is printed as a 5-tuple, and can optionally be written
 * as a Graphviz DOT file.
 */
public class RegexToDFA {
	private static final boolean DEBUG = Boolean.getBoolean("regexdfa.debug");
	
	/** Exit status: every regular expression was valid. */
	public static final int EXIT_OK = 0;
	/** Exit status: a regular expression was invalid. */
	public static final int EXIT_INVALID = 1;
	/** Exit status: bad command line, alphabet, or file. */
	public static final int EXIT_USAGE = 2;
	
	private static final String USAGE =
			"Usage: java -jar regex-dfa.jar [options] <regex>\n" +
			"       java -jar regex-dfa.jar [options] -f <file>\n" +
			"Options:\n" +
			"  -a <alphabet>  alphabet symbols (default: " + Alphabet.LOWERCASE + ")\n" +
			"  -o <file>      write the DFA in DOT format (with -f: directory for <n>.dot files)\n" +
			"  -k             keep unreachable and dead states\n" +
			"  -v             print the intermediate forms of the regex\n" +
			"  -m <input>     check whether the DFA accepts the input (may be repeated)\n" +
			"  -f <file>      read regexes from file, one per line (# starts a comment)\n";
	
	private final PrintStream out;
	private final PrintStream err;
	
	private String alphabetSpec = Alphabet.LOWERCASE;
	private String dotOutput;
	private boolean prune = true;
	private boolean verbose;
	private String batchFile;
	private String regexp;
	private List<String> inputs = new ArrayList<String>();
	
	private int lineNumber;
	
	/**
	 * Constructor.
	 * 
	 * @param out stream for regular output
	 * @param err stream for error messages
	 */
	public RegexToDFA(PrintStream out, PrintStream err) {
		this.out = out;
		this.err = err;
	}
	
	/**
	 * Run the tool.
	 * 
	 * @param args the command line arguments
	 * @return the exit status
	 */
	public int execute(String[] args) {
		if (!parseArgs(args)) {
			err.print(USAGE);
			return EXIT_USAGE;
		}
		
		Alphabet alphabet;
		try {
			alphabet = Alphabet.parse(alphabetSpec);
		} catch (IllegalArgumentException e) {
			err.println("Invalid alphabet: " + e.getMessage());
			return EXIT_USAGE;
		}
		
		ConvertRegexpToDFA converter = new ConvertRegexpToDFA(alphabet);
		try {
			if (batchFile == null)
				return convert(converter, regexp, dotOutput) ? EXIT_OK : EXIT_INVALID;
			else
				return convertAll(converter);
		} catch (IOException e) {
			err.println("Error: " + e.getMessage());
			return EXIT_USAGE;
		}
	}
	
	private boolean parseArgs(String[] args) {
		int i = 0;
		while (i < args.length && args[i].startsWith("-") && args[i].length() > 1) {
			String opt = args[i++];
			switch (opt) {
			case "-k":
				prune = false;
				break;
			case "-v":
				verbose = true;
				break;
			case "-a":
			case "-o":
			case "-m":
			case "-f":
				if (i >= args.length) {
					err.println("Option " + opt + " requires an argument");
					return false;
				}
				String value = args[i++];
				if (opt.equals("-a"))
					alphabetSpec = value;
				else if (opt.equals("-o"))
					dotOutput = value;
				else if (opt.equals("-m"))
					inputs.add(value);
				else
					batchFile = value;
				break;
			default:
				err.println("Unknown option " + opt);
				return false;
			}
		}
		
		int remaining = args.length - i;
		if (batchFile != null)
			return remaining == 0;
		if (remaining != 1)
			return false;
		regexp = args[i];
		return true;
	}
	
	private int convertAll(ConvertRegexpToDFA converter) throws IOException {
		File dotDir = null;
		if (dotOutput != null) {
			dotDir = new File(dotOutput);
			if (!dotDir.isDirectory() && !dotDir.mkdirs())
				throw new IOException("Could not create directory " + dotOutput);
		}
		
		int status = EXIT_OK;
		int count = 0;
		try (Scanner scanner = new Scanner(new FileReader(batchFile))) {
			for (;;) {
				String line = readNonCommentLine(scanner);
				if (line == null)
					break;
				++count;
				out.printf("[%d] line %d: %s\n", count, lineNumber, line);
				String dotFile = (dotDir != null) ? new File(dotDir, count + ".dot").getPath() : null;
				if (!convert(converter, line, dotFile))
					status = EXIT_INVALID;
				out.println();
			}
		}
		return status;
	}
	
	private boolean convert(ConvertRegexpToDFA converter, String regexp, String dotFile) throws IOException {
		CompilationResult result = converter.compile(regexp, prune);
		
		if (verbose) {
			out.println("Infix: " + result.getInfix());
			out.println("With explicit concat: " + result.getWithConcatenation());
			if (result.getPostfix() != null)
				out.println("Postfix: " + result.getPostfix());
		}
		
		if (!result.isValid()) {
			err.println("Regex '" + regexp + "' is invalid: " + result.getError().getMessage());
			return false;
		}
		
		FiniteAutomaton dfa = result.getDFA();
		out.print(new FormatFiveTuple(converter.getAlphabet()).format(dfa));
		
		if (!inputs.isEmpty()) {
			ExecuteDFA executeDFA = new ExecuteDFA();
			executeDFA.setAutomaton(dfa);
			for (String input : inputs)
				out.printf("\"%s\": %s\n", input, executeDFA.execute(input) ? "accepted" : "rejected");
		}
		
		if (dotFile != null) {
			try (PrintWriter writer = new PrintWriter(new FileWriter(dotFile))) {
				new ExportDOT().export(dfa, writer);
			}
		}
		
		return true;
	}
	
	private String readNonCommentLine(Scanner scanner) {
		for (;;) {
			if (!scanner.hasNextLine())
				return null;
			String line = scanner.nextLine();
			++lineNumber;
			line = line.strip();
			if (!line.isEmpty() && !line.startsWith("#"))
				return line;
		}
	}
	
	public static void main(String[] args) {
		if (DEBUG) {
			Logger logger = Logger.getLogger("io.github.regexdfa");
			ConsoleHandler handler = new ConsoleHandler();
			handler.setLevel(Level.FINE);
			logger.addHandler(handler);
			logger.setLevel(Level.FINE);
		}
		RegexToDFA tool = new RegexToDFA(System.out, System.err);
		System.exit(tool.execute(args));
	}
}
