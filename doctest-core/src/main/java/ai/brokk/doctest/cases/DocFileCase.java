package ai.brokk.doctest.cases;

import ai.brokk.doctest.api.ExampleBlock;
import ai.brokk.doctest.api.TestAddress;

/** The single example block of a standalone text file. Text files have no module or call path. */
public final class DocFileCase implements RunnableDoctest {
    private final ExampleBlock block;
    private final String filename;

    public DocFileCase(ExampleBlock block) {
        var file = block.filename();
        if (file == null) {
            throw new IllegalArgumentException("File blocks must carry their filename: " + block);
        }
        this.block = block;
        this.filename = file;
    }

    @Override
    public ExampleBlock block() {
        return block;
    }

    /** The file name with dots turned into underscores, e.g. {@code guide_txt}. */
    @Override
    public String id() {
        return block.name().replace('.', '_');
    }

    @Override
    public TestAddress address() {
        return TestAddress.forFile(filename);
    }

    @Override
    public String shortDescription() {
        return "Doctest: " + block.name();
    }

    @Override
    public String toString() {
        return filename;
    }
}
