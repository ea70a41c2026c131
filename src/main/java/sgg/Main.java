package sgg;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.File;
import java.io.IOException;
import java.util.logging.Logger;

import com.google.common.io.Files;

import sgg.grammars.GrammarConfiguration;
import sgg.grammars.GrammarGenerator;
import sgg.schema.InvalidSchemaException;
import sgg.schema.SchemaLoader;
import sgg.schema.SyntaxSchema;

public class Main {

	private static final Logger log = Logger.getLogger(Main.class.getName());

	public static void main(String[] args) {
		System.exit(run(args));
	}

	/**
	 * @return the process exit code
	 */
	public static int run(String[] args) {
		if (args.length < 2 || args.length > 3) {
			System.out.println("2 or 3 parameters required.");
			System.out.println("parameter 1: schema file");
			System.out.println("parameter 2: output file");
			System.out.println("parameter 3 (optional): configuration properties, default is the C# profile");
			return 2;
		}
		try {
			File schemaFile = new File(args[0]);
			File outputFile = new File(args[1]);

			SyntaxSchema schema = SchemaLoader.load(schemaFile);
			GrammarConfiguration config = args.length == 3
					? GrammarConfiguration.load(new File(args[2]))
					: GrammarConfiguration.csharp();

			String grammar = compileGrammar(schema, config);

			writeGrammar(outputFile, grammar);
			log.info("Wrote grammar " + config.getGrammarName() + " to " + outputFile);
			return 0;
		} catch (InvalidSchemaException e) {
			System.out.println(e.getMessage());
			return 1;
		} catch (Exception e) {
			e.printStackTrace();
			System.out.println(e.getMessage());
			return 3;
		}
	}

	public static String compileGrammar(SyntaxSchema schema, GrammarConfiguration config) {
		return new GrammarGenerator(schema, config).generate();
	}

	private static void writeGrammar(File outputFile, String grammar) throws IOException {
		Files.createParentDirs(outputFile);
		Files.asCharSink(outputFile, UTF_8).write(grammar);
	}

}
