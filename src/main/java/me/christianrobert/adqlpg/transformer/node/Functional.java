package me.christianrobert.adqlpg.transformer.node;

import java.util.List;

/**
 * A function-call-shaped node.
 */
public interface Functional {

    /** Upper-cased function name. */
    String getFunctionName();

    /** One node per comma separated argument. */
    List<AdqlNode> getArgs();

    /** The arguments rendered as SQL, computed when the node was built. */
    List<String> getFlattenedArgs();
}
