package com.nei10u.cosmic.engine;

import com.nei10u.cosmic.model.GeneKey;

import java.util.List;

/**
 * 64 把基因钥匙，下标 = 编号 − 1，编号与人类图闸门号一致。
 */
final class GeneKeysTables {

    static final List<GeneKey> GENE_KEYS = List.of(
            new GeneKey(1, "Entropy", "Freshness", "Beauty", "From Self-Absorption to Fresh Beauty", "Ring of Fire"),
            new GeneKey(2, "Dislocation", "Orientation", "Unity", "Returning to the One", "Ring of Water"),
            new GeneKey(3, "Chaos", "Innovation", "Innocence", "Through the Eyes of a Child", "Ring of Life and Death"),
            new GeneKey(4, "Intolerance", "Understanding", "Forgiveness", "A Universal Panacea", "Ring of Union"),
            new GeneKey(5, "Impatience", "Patience", "Timelessness", "The Ending of Time", "Ring of Light"),
            new GeneKey(6, "Conflict", "Diplomacy", "Peace", "The Path to Peace", "Ring of Alchemy"),
            new GeneKey(7, "Division", "Guidance", "Virtue", "The Army of Light", "Ring of Union"),
            new GeneKey(8, "Mediocrity", "Style", "Exquisiteness", "The Diamond of Your True Self", "Ring of Water"),
            new GeneKey(9, "Inertia", "Determination", "Invincibility", "The Power of the Infinitesimal", "Ring of Light"),
            new GeneKey(10, "Self-Obsession", "Naturalness", "Being", "Being at Ease", "Ring of Humanity"),
            new GeneKey(11, "Obscurity", "Idealism", "Light", "The Light of Eden", "Ring of Light"),
            new GeneKey(12, "Vanity", "Discrimination", "Purity", "A Pure Heart", "Ring of Trials"),
            new GeneKey(13, "Discord", "Discernment", "Empathy", "Listening Through Love", "Ring of Purification"),
            new GeneKey(14, "Compromise", "Competence", "Bounteousness", "Radiating Prosperity", "Ring of Fire"),
            new GeneKey(15, "Dullness", "Magnetism", "Florescence", "An Eternally Flowering Spring", "Ring of Seeking"),
            new GeneKey(16, "Indifference", "Versatility", "Mastery", "Magical Genius", "Ring of Prosperity"),
            new GeneKey(17, "Opinion", "Far-Sightedness", "Omniscience", "The Eye", "Ring of Humanity"),
            new GeneKey(18, "Judgement", "Integrity", "Perfection", "The Healing Power of Mind", "Ring of Matter"),
            new GeneKey(19, "Co-dependence", "Sensitivity", "Sacrifice", "The Future Human Being", "Ring of Gaia"),
            new GeneKey(20, "Superficiality", "Self-Assurance", "Presence", "The Sacred Om", "Ring of Life and Death"),
            new GeneKey(21, "Control", "Authority", "Valour", "A Noble Life", "Ring of Humanity"),
            new GeneKey(22, "Dishonour", "Graciousness", "Grace", "Grace Under Pressure", "Ring of Divinity"),
            new GeneKey(23, "Complexity", "Simplicity", "Quintessence", "The Alchemy of Simplicity", "Ring of Life and Death"),
            new GeneKey(24, "Addiction", "Invention", "Silence", "The Paradise State", "Ring of Life and Death"),
            new GeneKey(25, "Constriction", "Acceptance", "Universal Love", "The Myth of the Sacred Wound", "Ring of Humanity"),
            new GeneKey(26, "Pride", "Artfulness", "Invisibility", "Sacred Tricksters", "Ring of Light"),
            new GeneKey(27, "Selfishness", "Altruism", "Selflessness", "Food of the Gods", "Ring of Life and Death"),
            new GeneKey(28, "Purposelessness", "Totality", "Immortality", "Embracing the Dark Side", "Ring of Illusion"),
            new GeneKey(29, "Half-Heartedness", "Commitment", "Devotion", "Leaping into the Void", "Ring of Union"),
            new GeneKey(30, "Desire", "Lightness", "Rapture", "Celestial Fire", "Ring of Purification"),
            new GeneKey(31, "Arrogance", "Leadership", "Humility", "Sounding Your Truth", "Ring of No Return"),
            new GeneKey(32, "Failure", "Preservation", "Veneration", "Ancestral Reverence", "Ring of Illusion"),
            new GeneKey(33, "Forgetting", "Mindfulness", "Revelation", "The Final Revelation", "Ring of Trials"),
            new GeneKey(34, "Force", "Strength", "Majesty", "The Beauty of the Beast", "Ring of Alchemy"),
            new GeneKey(35, "Hunger", "Adventure", "Boundlessness", "Wormholes and Miracles", "Ring of Miracles"),
            new GeneKey(36, "Turbulence", "Humanity", "Compassion", "Becoming Human", "Ring of Divinity"),
            new GeneKey(37, "Weakness", "Equality", "Tenderness", "Family Alchemy", "Ring of Divinity"),
            new GeneKey(38, "Struggle", "Perseverance", "Honour", "The Warrior of Light", "Ring of Destiny"),
            new GeneKey(39, "Provocation", "Dynamism", "Liberation", "The Tension of Transcendence", "Ring of Seeking"),
            new GeneKey(40, "Exhaustion", "Resolve", "Divine Will", "The Will to Surrender", "Ring of Alchemy"),
            new GeneKey(41, "Fantasy", "Anticipation", "Emanation", "The Prime Emanation", "Ring of Origin"),
            new GeneKey(42, "Expectation", "Detachment", "Celebration", "Letting Go of Living and Dying", "Ring of Matter"),
            new GeneKey(43, "Deafness", "Insight", "Epiphany", "Breakthrough", "Ring of Destiny"),
            new GeneKey(44, "Interference", "Teamwork", "Synarchy", "Karmic Relationships", "Ring of Illusion"),
            new GeneKey(45, "Dominance", "Synergy", "Communion", "Cosmic Communion", "Ring of Prosperity"),
            new GeneKey(46, "Seriousness", "Delight", "Ecstasy", "A Science of Luck", "Ring of Matter"),
            new GeneKey(47, "Oppression", "Transmutation", "Transfiguration", "Transmuting the Past", "Ring of Alchemy"),
            new GeneKey(48, "Inadequacy", "Resourcefulness", "Wisdom", "The Wonder of Uncertainty", "Ring of Matter"),
            new GeneKey(49, "Reaction", "Revolution", "Rebirth", "Changing the World from the Inside", "Ring of the Whirlwind"),
            new GeneKey(50, "Corruption", "Equilibrium", "Harmony", "Cosmic Order", "Ring of Illuminati"),
            new GeneKey(51, "Agitation", "Initiative", "Awakening", "Initiative to Awakening", "Ring of Humanity"),
            new GeneKey(52, "Stress", "Restraint", "Stillness", "The Stillpoint", "Ring of Seeking"),
            new GeneKey(53, "Immaturity", "Expansion", "Superabundance", "Evolving Beyond Evolution", "Ring of Seeking"),
            new GeneKey(54, "Greed", "Aspiration", "Ascension", "The Serpent Path", "Ring of Gaia"),
            new GeneKey(55, "Victimisation", "Freedom", "Freedom", "The Dragonfly's Dream", "Ring of the Whirlwind"),
            new GeneKey(56, "Distraction", "Enrichment", "Intoxication", "Divine Intoxication", "Ring of Trials"),
            new GeneKey(57, "Unease", "Intuition", "Clarity", "A Gentle Wind", "Ring of Matter"),
            new GeneKey(58, "Dissatisfaction", "Vitality", "Bliss", "From Dissatisfaction to Bliss", "Ring of Seeking"),
            new GeneKey(59, "Dishonesty", "Intimacy", "Transparency", "The Dragon in Your Genome", "Ring of Union"),
            new GeneKey(60, "Limitation", "Realism", "Justice", "The Cracking of the Vessel", "Ring of Gaia"),
            new GeneKey(61, "Psychosis", "Inspiration", "Sanctity", "The Holy of Holies", "Ring of Gaia"),
            new GeneKey(62, "Intellect", "Precision", "Impeccability", "The Language of Light", "Ring of No Return"),
            new GeneKey(63, "Doubt", "Inquiry", "Truth", "Reaching the Source", "Ring of Origin"),
            new GeneKey(64, "Confusion", "Imagination", "Illumination", "The Aurora", "Ring of Origin")
    );

    private GeneKeysTables() {
    }

    static GeneKey key(int number) {
        if (number < 1 || number > GENE_KEYS.size()) {
            throw new IllegalArgumentException("gene key out of range: " + number);
        }
        return GENE_KEYS.get(number - 1);
    }
}
