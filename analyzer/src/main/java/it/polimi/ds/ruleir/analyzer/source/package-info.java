@NullMarked
package it.polimi.ds.ruleir.analyzer.source;

import org.jspecify.annotations.NullMarked;
