@NullMarked
package it.polimi.ds.ruleir.analyzer.env;

import org.jspecify.annotations.NullMarked;
