@NullMarked
package it.polimi.ds.ruleir.analyzer.resolve;

import org.jspecify.annotations.NullMarked;
