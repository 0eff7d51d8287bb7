package org.dxworks.metamark;

import org.dxworks.metamark.error.MetaMarkException;
import org.dxworks.metamark.model.Document;
import org.dxworks.metamark.parser.BlockParser;
import org.dxworks.metamark.scanner.Scanner;

/**
 * Entry point of the library: MetaMark source text in, document tree out.
 */
public final class MetaMark {

    private MetaMark() {
    }

    public static Document parseDocument(String source) throws MetaMarkException {
        return parseDocument(source, MetamarkConfig.defaults());
    }

    public static Document parseDocument(String source, MetamarkConfig config) throws MetaMarkException {
        return new BlockParser(new Scanner(source), config).parse();
    }
}
