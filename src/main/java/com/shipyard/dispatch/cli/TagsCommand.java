package com.shipyard.dispatch.cli;

import com.shipyard.core.model.DerivedTags;
import com.shipyard.core.tagging.TagDeriver;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: shipyard tags --ref R --commit C
 * <p>
 * Prints the two tags a build of this ref and commit would be published under.
 */
@Command(name = "tags", mixinStandardHelpOptions = true, description = "Show the tags derived for a ref and commit")
@Component
public class TagsCommand implements Callable<Integer> {

    @Option(names = {"--ref", "-r"}, description = "Branch or merge ref")
    private String ref;

    @Option(names = {"--commit", "-c"}, required = true, description = "Commit identifier")
    private String commit;

    private final TagDeriver tagDeriver;

    public TagsCommand(TagDeriver tagDeriver) {
        this.tagDeriver = tagDeriver;
    }

    @Override
    public Integer call() {
        DerivedTags tags;
        try {
            tags = tagDeriver.deriveTags(ref, commit);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return ShipyardCommand.EXIT_USAGE;
        }
        System.out.println("mutable:   " + tags.mutableTag().reference());
        System.out.println("immutable: " + tags.immutableTag().reference());
        return ShipyardCommand.EXIT_OK;
    }
}
