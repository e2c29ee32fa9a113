package org.logic.error;

/**
 * Classificazione degli errori rilevati dal workbench.
 *
 * Ogni errore viene rilevato sull'unità più piccola in grado di riconoscerlo
 * (una formula, una riga di prova) e non viene mai recuperato.
 */
public enum ErrorKind {
    LEXICAL,    // Carattere fuori dall'alfabeto ammesso
    SYNTAX,     // Parentesi sbilanciate, operandi mancanti, token residui, giustificazioni malformate
    SEMANTIC,   // Regola sconosciuta, arità errata, mismatch strutturale
    SCOPE       // BeginScope/EndScope sbilanciati, riferimenti a scope non accessibili
}
