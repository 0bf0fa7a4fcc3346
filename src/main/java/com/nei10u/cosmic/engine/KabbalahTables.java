package com.nei10u.cosmic.engine;

import com.nei10u.cosmic.model.Sephirah;
import com.nei10u.cosmic.model.SoulCorrection;

import java.util.List;

/**
 * 卡巴拉常量表：生命之树十个质点，以及 72 圣名对应的灵魂修正。
 */
final class KabbalahTables {

    static final List<Sephirah> SEPHIROT = List.of(
            new Sephirah("Keter", "כתר", "Crown", "Divine Will, the source of all creation", 1),
            new Sephirah("Chokmah", "חכמה", "Wisdom", "The first flash of inspiration, raw creative force", 2),
            new Sephirah("Binah", "בינה", "Understanding", "The womb of creation, where ideas take form", 3),
            new Sephirah("Chesed", "חסד", "Mercy", "Unconditional love, expansion, generosity", 4),
            new Sephirah("Gevurah", "גבורה", "Strength", "Discipline, boundaries, the power to refine", 5),
            new Sephirah("Tiferet", "תפארת", "Beauty", "Harmony, balance, the heart of the Tree", 6),
            new Sephirah("Netzach", "נצח", "Victory", "Endurance, eternity, creative persistence", 7),
            new Sephirah("Hod", "הוד", "Splendor", "Intellect, communication, surrender to truth", 8),
            new Sephirah("Yesod", "יסוד", "Foundation", "Connection, dreams, the bridge between worlds", 9),
            new Sephirah("Malkhut", "מלכות", "Kingdom", "Manifestation, the physical world, grounding", 10)
    );

    static final List<SoulCorrection> SOUL_CORRECTIONS = List.of(
            new SoulCorrection(1, "Time Travel",
                    "You have the ability to transcend linear time through consciousness.",
                    "Impatience with the present moment",
                    "Learning to be fully present while holding vision of the future"),
            new SoulCorrection(2, "Recapturing the Sparks",
                    "Your soul seeks to gather scattered fragments of light.",
                    "Feeling scattered or unfocused",
                    "Gathering your energy and finding wholeness within"),
            new SoulCorrection(3, "Miracle Making",
                    "You carry the potential to manifest the extraordinary.",
                    "Doubt in your own power",
                    "Trusting in the miraculous nature of your being"),
            new SoulCorrection(4, "Eliminating Negative Thoughts",
                    "Your mind is a powerful creator.",
                    "Negative self-talk and limiting beliefs",
                    "Mastering the mind and choosing thoughts that serve your highest self"),
            new SoulCorrection(5, "Healing",
                    "You are a natural healer of yourself and others.",
                    "Taking on others' pain as your own",
                    "Learning to heal through Light rather than through absorption"),
            new SoulCorrection(6, "Dream State",
                    "You access higher realms through dreams and vision.",
                    "Escapism and avoiding reality",
                    "Grounding spiritual insight into practical action"),
            new SoulCorrection(7, "DNA of the Soul",
                    "Your essence carries deep ancestral wisdom.",
                    "Repeating family patterns unconsciously",
                    "Breaking generational chains through conscious awareness"),
            new SoulCorrection(8, "Defying Gravity",
                    "You are meant to transcend limitations.",
                    "Feeling weighed down by the physical world",
                    "Rising above circumstances through spiritual lightness"),
            new SoulCorrection(9, "Angelic Influences",
                    "You have a strong connection to angelic realms.",
                    "Feeling ungrounded or too ethereal",
                    "Bridging heaven and earth in daily life"),
            new SoulCorrection(10, "Looks Can Kill",
                    "Your gaze carries immense power.",
                    "Using personal magnetism for ego",
                    "Directing your power toward blessing others"),
            new SoulCorrection(11, "Letting Go",
                    "Freedom comes through release.",
                    "Holding on too tightly to outcomes",
                    "Surrendering control and trusting the flow of life"),
            new SoulCorrection(12, "Unconditional Love",
                    "Your path leads to love without conditions.",
                    "Placing conditions on love and acceptance",
                    "Opening the heart to love all beings as they are"),
            new SoulCorrection(13, "Heaven on Earth",
                    "You are meant to bring paradise into the material world.",
                    "Seeing spiritual and material as separate",
                    "Infusing every moment with sacred awareness"),
            new SoulCorrection(14, "Farewell to Arms",
                    "Peace is your ultimate destination.",
                    "Engaging in unnecessary conflicts",
                    "Choosing peace over being right"),
            new SoulCorrection(15, "Long-Range Vision",
                    "You see further than most.",
                    "Frustration when others cannot see what you see",
                    "Patience with the unfolding of your vision"),
            new SoulCorrection(16, "Dumping Depression",
                    "Joy is your birthright.",
                    "Cycles of melancholy and heaviness",
                    "Choosing joy as a spiritual practice"),
            new SoulCorrection(17, "Great Escape",
                    "You seek liberation in all forms.",
                    "Running from difficult situations",
                    "Finding freedom within constraints"),
            new SoulCorrection(18, "Fertility",
                    "You create abundance wherever you go.",
                    "Fear of scarcity or not having enough",
                    "Trusting in your infinite creative capacity"),
            new SoulCorrection(19, "Dialing God",
                    "Direct connection to the Divine is your gift.",
                    "Feeling spiritually disconnected",
                    "Cultivating constant communion with the sacred"),
            new SoulCorrection(20, "Victory Over Addictions",
                    "Freedom from compulsive patterns.",
                    "Addictive tendencies in various forms",
                    "Filling the void with spiritual nourishment"),
            new SoulCorrection(21, "Eradicate Plague",
                    "You have the power to transform collective suffering.",
                    "Absorbing collective negativity",
                    "Transmuting darkness into light for the collective"),
            new SoulCorrection(22, "Stop Fatal Attraction",
                    "Wisdom in relationships.",
                    "Attraction to harmful patterns",
                    "Choosing relationships that elevate your soul"),
            new SoulCorrection(23, "Sharing the Flame",
                    "Your light is meant to be shared.",
                    "Hoarding wisdom or hiding your gifts",
                    "Generously sharing your spiritual light"),
            new SoulCorrection(24, "Jealousy",
                    "Transforming envy into inspiration.",
                    "Comparing yourself to others",
                    "Celebrating others' success as your own"),
            new SoulCorrection(25, "Speak Your Mind",
                    "Truth is your currency.",
                    "Fear of speaking your truth",
                    "Finding the courage to voice what you know"),
            new SoulCorrection(26, "Order from Chaos",
                    "You bring structure to the formless.",
                    "Feeling overwhelmed by disorder",
                    "Finding the sacred pattern within apparent chaos"),
            new SoulCorrection(27, "Silent Partner",
                    "Power through stillness.",
                    "Needing external validation",
                    "Finding strength in quiet inner knowing"),
            new SoulCorrection(28, "Soul Mate",
                    "Deep partnership is your teacher.",
                    "Codependency or fear of intimacy",
                    "Becoming whole within to attract wholeness"),
            new SoulCorrection(29, "Removing Hatred",
                    "Love dissolves all barriers.",
                    "Harboring resentment or judgment",
                    "Practicing radical forgiveness"),
            new SoulCorrection(30, "Building Bridges",
                    "You connect what is divided.",
                    "Taking sides in conflicts",
                    "Seeing the unity beneath all division"),
            new SoulCorrection(31, "Finish What You Start",
                    "Completion is your mastery.",
                    "Starting many things, finishing few",
                    "Honoring commitments through to their natural end"),
            new SoulCorrection(32, "Memories",
                    "The past holds keys to your future.",
                    "Being trapped by past experiences",
                    "Mining wisdom from memory without being enslaved by it"),
            new SoulCorrection(33, "Revealing the Dark Side",
                    "Shadow work is your path.",
                    "Denying your shadow aspects",
                    "Embracing and integrating all parts of yourself"),
            new SoulCorrection(34, "Forget Thyself",
                    "Service dissolves the ego.",
                    "Self-centeredness or narcissism",
                    "Finding yourself through selfless service"),
            new SoulCorrection(35, "Sexual Energy",
                    "Creative life force flows through you.",
                    "Misusing sexual or creative energy",
                    "Channeling creative energy toward sacred purposes"),
            new SoulCorrection(36, "Fearless",
                    "Courage is your essence.",
                    "Hidden fears controlling decisions",
                    "Walking directly toward what you fear most"),
            new SoulCorrection(37, "The Big Picture",
                    "You see the grand design.",
                    "Getting lost in details",
                    "Maintaining perspective of the whole while attending to parts"),
            new SoulCorrection(38, "Circuitry",
                    "You are a conduit for cosmic energy.",
                    "Energetic overwhelm or burnout",
                    "Learning to conduct energy without depleting yourself"),
            new SoulCorrection(39, "Diamond in the Rough",
                    "Pressure creates your brilliance.",
                    "Resisting necessary challenges",
                    "Embracing difficulty as your path to refinement"),
            new SoulCorrection(40, "Global Transformation",
                    "Your personal change ripples outward.",
                    "Feeling too small to make a difference",
                    "Understanding that your transformation transforms the world"),
            new SoulCorrection(41, "Self-Appreciation",
                    "You are worthy simply because you exist.",
                    "Chronic self-deprecation",
                    "Recognizing your inherent divine worth"),
            new SoulCorrection(42, "Revealing the Concealed",
                    "You see what is hidden.",
                    "Using insight manipulatively",
                    "Revealing truth with compassion and timing"),
            new SoulCorrection(43, "Defying Death",
                    "You transcend mortality through consciousness.",
                    "Fear of death and endings",
                    "Living so fully that death becomes irrelevant"),
            new SoulCorrection(44, "Sweetening Judgment",
                    "Mercy tempers justice.",
                    "Being overly critical of self and others",
                    "Balancing discernment with compassion"),
            new SoulCorrection(45, "The Power of Prosperity",
                    "Abundance is your natural state.",
                    "Guilt around wealth or success",
                    "Receiving abundantly and sharing generously"),
            new SoulCorrection(46, "Absolute Certainty",
                    "Faith beyond evidence.",
                    "Needing proof before believing",
                    "Cultivating certainty in the unseen"),
            new SoulCorrection(47, "Global Communication",
                    "Your words reach far.",
                    "Miscommunication or gossip",
                    "Speaking words that heal and unite"),
            new SoulCorrection(48, "Unity",
                    "Oneness is your truth.",
                    "Feeling separate or isolated",
                    "Experiencing the interconnection of all life"),
            new SoulCorrection(49, "Happiness",
                    "Joy is a choice and a practice.",
                    "Conditional happiness",
                    "Choosing happiness regardless of circumstances"),
            new SoulCorrection(50, "Enough Is Never Enough",
                    "Learning the art of satisfaction.",
                    "Constant craving for more",
                    "Finding completeness in what is"),
            new SoulCorrection(51, "No Guilt",
                    "Freedom from false guilt.",
                    "Carrying guilt that isn't yours",
                    "Releasing guilt and stepping into innocence"),
            new SoulCorrection(52, "Passion",
                    "Deep feeling is your fuel.",
                    "Emotional overwhelm or numbness",
                    "Channeling passion into purposeful creation"),
            new SoulCorrection(53, "No Agenda",
                    "Pure being without manipulation.",
                    "Hidden agendas in relationships",
                    "Relating with pure authenticity"),
            new SoulCorrection(54, "The Death of Death",
                    "You transcend all endings.",
                    "Resistance to transformation",
                    "Welcoming each death as a doorway to rebirth"),
            new SoulCorrection(55, "Thought into Action",
                    "Your thoughts manifest reality.",
                    "Overthinking without acting",
                    "Translating inspiration into embodied action"),
            new SoulCorrection(56, "Dispelling Anger",
                    "Transforming rage into power.",
                    "Suppressed or explosive anger",
                    "Alchemizing anger into constructive force"),
            new SoulCorrection(57, "Listen to Your Heart",
                    "The heart knows the way.",
                    "Overriding heart wisdom with logic",
                    "Trusting the intelligence of the heart"),
            new SoulCorrection(58, "Letting Go of Ego",
                    "True power lies beyond ego.",
                    "Ego-driven decisions and identity",
                    "Discovering who you are beyond the ego"),
            new SoulCorrection(59, "Umbilical Cord",
                    "Connection to source.",
                    "Feeling cut off from spiritual nourishment",
                    "Remembering your eternal connection to the Divine"),
            new SoulCorrection(60, "Spiritual Cleansing",
                    "Purification of the soul.",
                    "Accumulating spiritual density",
                    "Regular practices of energetic clearing and renewal"),
            new SoulCorrection(61, "Water",
                    "Flow is your nature.",
                    "Rigidity and resistance to change",
                    "Becoming like water, adaptable, powerful, and life-giving"),
            new SoulCorrection(62, "Parent-Loss",
                    "Transcending parental wounds.",
                    "Unresolved parental relationships",
                    "Becoming your own loving parent"),
            new SoulCorrection(63, "Appreciation",
                    "Gratitude transforms everything.",
                    "Taking life for granted",
                    "Cultivating deep appreciation for every breath"),
            new SoulCorrection(64, "Casting Off Negativity",
                    "You shed what no longer serves.",
                    "Absorbing environmental negativity",
                    "Maintaining your light regardless of surroundings"),
            new SoulCorrection(65, "Spiritual Umbilical Cord",
                    "Your connection to the infinite.",
                    "Spiritual dryness or disconnection",
                    "Nurturing your invisible connection to all that is"),
            new SoulCorrection(66, "Accountability",
                    "Owning your creation.",
                    "Blaming external circumstances",
                    "Taking full responsibility for your life experience"),
            new SoulCorrection(67, "Great Expectations",
                    "Release attachment to outcomes.",
                    "Disappointment when reality doesn't match expectations",
                    "Surrendering expectations while maintaining intention"),
            new SoulCorrection(68, "Contacting Departed Souls",
                    "You bridge the worlds of living and passed.",
                    "Grief or fear of death",
                    "Understanding death as a doorway, not an ending"),
            new SoulCorrection(69, "Lost and Found",
                    "What was lost returns transformed.",
                    "Mourning what you've lost",
                    "Trusting that nothing is ever truly lost"),
            new SoulCorrection(70, "Remembering",
                    "Ancient knowledge lives within you.",
                    "Forgetting your true nature",
                    "Awakening the deep memory of who you really are"),
            new SoulCorrection(71, "Prophecy and Parallel Universes",
                    "You sense multiple timelines.",
                    "Confusion about which path to take",
                    "Trusting your inner sight to guide you through possibilities"),
            new SoulCorrection(72, "Spiritual Cleansing",
                    "The final purification.",
                    "Carrying collective karma",
                    "Serving as a vessel of purification for the world")
    );

    private KabbalahTables() {
    }
}
