@NullMarked
package it.polimi.ds.ruleir.analyzer.fn;

import org.jspecify.annotations.NullMarked;
