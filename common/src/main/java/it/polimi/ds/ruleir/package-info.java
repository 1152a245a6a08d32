@NullMarked
package it.polimi.ds.ruleir;

import org.jspecify.annotations.NullMarked;
