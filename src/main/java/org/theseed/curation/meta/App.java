package org.theseed.curation.meta;

import java.util.Arrays;

/**
 * Commands for curating metabolic models.
 *
 * normalize	normalize the compartments and species IDs of an SBML model
 * extract		build a structured model snapshot from a flat network export
 * refine		apply curator edit tables to a structured model snapshot
 * names		list the reaction names in an SBML model
 */
public class App
{
    public static void main( String[] args )
    {
        // Get the control parameter.
        String command = args[0];
        String[] newArgs = Arrays.copyOfRange(args, 1, args.length);
        BaseCurationProcessor processor;
        // Determine the command to process.
        switch (command) {
        case "normalize" :
            processor = new NormalizeProcessor();
            break;
        case "extract" :
            processor = new ExtractProcessor();
            break;
        case "refine" :
            processor = new RefineProcessor();
            break;
        case "names" :
            processor = new ReactionNamesProcessor();
            break;
        default:
            throw new RuntimeException("Invalid command " + command);
        }
        // Process it.
        boolean ok = processor.parseCommand(newArgs);
        if (ok && ! processor.run())
            System.exit(1);
    }
}
