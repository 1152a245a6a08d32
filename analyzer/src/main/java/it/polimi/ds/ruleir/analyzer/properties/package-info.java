@NullMarked
package it.polimi.ds.ruleir.analyzer.properties;

import org.jspecify.annotations.NullMarked;
