package org.devo.assay;

import java.util.Arrays;

import org.devo.assay.utils.BaseProcessor;

/**
 * Commands for Simoa assay data processing
 *
 * batches		split an export file into batches and plates and write the well report
 * layout		list the design labels of every well for a set of plate templates
 *
 */
public class App
{
    public static void main( String[] args )
    {
        if (args.length < 1) {
            System.err.println("A command is required:  batches or layout.");
            System.exit(1);
        }
        // Get the control parameter.
        String command = args[0];
        String[] newArgs = Arrays.copyOfRange(args, 1, args.length);
        BaseProcessor processor;
        // Determine the command to process.
        switch (command) {
        case "batches" :
            processor = new BatchReportProcessor();
            break;
        case "layout" :
            processor = new LayoutProcessor();
            break;
        default:
            throw new RuntimeException("Invalid command " + command);
        }
        // Process it.
        boolean ok = processor.parseCommand(newArgs);
        if (ok) {
            processor.run();
        }
        if (processor.isFailed())
            System.exit(1);
    }
}
