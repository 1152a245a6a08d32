@NullMarked
package it.polimi.ds.ruleir.analyzer.lower;

import org.jspecify.annotations.NullMarked;
